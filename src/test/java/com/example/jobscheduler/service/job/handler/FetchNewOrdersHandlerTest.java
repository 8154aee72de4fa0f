package com.example.jobscheduler.service.job.handler;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.exception.JobExecutionException;
import com.example.jobscheduler.integration.ShopDirectory;
import com.example.jobscheduler.integration.StorefrontGateway;
import com.example.jobscheduler.integration.SyncOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FetchNewOrdersHandler Tests")
class FetchNewOrdersHandlerTest {

    @Mock
    private ObjectProvider<ShopDirectory> shopDirectoryProvider;

    @Mock
    private ObjectProvider<StorefrontGateway> storefrontProvider;

    @Mock
    private ShopDirectory shopDirectory;

    @Mock
    private StorefrontGateway storefront;

    private FetchNewOrdersHandler handler;

    @BeforeEach
    void setUp() {
        handler = new FetchNewOrdersHandler(shopDirectoryProvider, storefrontProvider);
    }

    private static JobSchedule schedule(Long shopId, Map<String, Object> options) {
        return JobSchedule.builder()
                .id(UUID.randomUUID())
                .name("Fetch new orders")
                .jobType("orders.fetch_new")
                .shopId(shopId)
                .options(new HashMap<>(options))
                .build();
    }

    @Nested
    @DisplayName("Shop resolution")
    class ShopResolutionTests {

        @Test
        @DisplayName("Shop-bound schedule syncs only that shop")
        void shopBoundSchedule() {
            when(storefrontProvider.getIfAvailable()).thenReturn(storefront);
            when(storefront.fetchNewOrders(5L, 12)).thenReturn(SyncOutcome.processed(8));

            var result = handler.execute(schedule(5L, Map.of("fallback_lookback_hours", 12)));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMessage()).isEqualTo("8 orders synchronised for 1 shop(s)");
            verifyNoInteractions(shopDirectoryProvider);
        }

        @Test
        @DisplayName("Unbound schedule syncs every shop of the provider")
        void unboundScheduleSyncsAllShops() {
            when(shopDirectoryProvider.getIfAvailable()).thenReturn(shopDirectory);
            when(shopDirectory.findShopIdsByProvider("shoptet")).thenReturn(List.of(1L, 2L, 3L));
            when(storefrontProvider.getIfAvailable()).thenReturn(storefront);
            when(storefront.fetchNewOrders(anyLong(), eq(24))).thenReturn(
                    SyncOutcome.processed(2), SyncOutcome.skipped(), SyncOutcome.processed(5));

            var result = handler.execute(schedule(null, Map.of()));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMessage()).isEqualTo("7 orders synchronised for 2 shop(s)");
            assertThat(result.getDetails()).containsEntry("skippedShops", 1).containsEntry("shops", 3);
        }

        @Test
        @DisplayName("No eligible shop completes without work")
        void noEligibleShop() {
            when(shopDirectoryProvider.getIfAvailable()).thenReturn(shopDirectory);
            when(shopDirectory.findShopIdsByProvider("shoptet")).thenReturn(List.of());

            var result = handler.execute(schedule(null, Map.of()));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getMessage()).startsWith("No shop synchronised");
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Failing shop fails the run after the other shops were synced")
        void failingShopFailsRunAfterOthers() {
            when(shopDirectoryProvider.getIfAvailable()).thenReturn(shopDirectory);
            when(shopDirectory.findShopIdsByProvider("shoptet")).thenReturn(List.of(1L, 2L));
            when(storefrontProvider.getIfAvailable()).thenReturn(storefront);
            when(storefront.fetchNewOrders(1L, 24)).thenThrow(new IllegalStateException("token expired"));
            when(storefront.fetchNewOrders(2L, 24)).thenReturn(SyncOutcome.processed(3));

            assertThatThrownBy(() -> handler.execute(schedule(null, Map.of())))
                    .isInstanceOf(JobExecutionException.class)
                    .hasMessageContaining("Failed for 1 of 2 shop(s)")
                    .hasMessageContaining("shop 1: token expired");
            verify(storefront).fetchNewOrders(2L, 24);
        }

        @Test
        @DisplayName("Missing storefront gateway fails with a clear message")
        void missingGateway() {
            when(storefrontProvider.getIfAvailable()).thenReturn(null);

            assertThatThrownBy(() -> handler.execute(schedule(5L, Map.of())))
                    .isInstanceOf(JobExecutionException.class)
                    .hasMessageContaining("No StorefrontGateway is configured");
        }

        @Test
        @DisplayName("Lookback below one hour is raised to one")
        void lookbackClamped() {
            when(storefrontProvider.getIfAvailable()).thenReturn(storefront);
            when(storefront.fetchNewOrders(5L, 1)).thenReturn(SyncOutcome.processed(0));

            handler.execute(schedule(5L, Map.of("fallback_lookback_hours", -4)));

            verify(storefront).fetchNewOrders(5L, 1);
        }
    }
}
