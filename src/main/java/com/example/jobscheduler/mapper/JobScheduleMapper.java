package com.example.jobscheduler.mapper;

import com.example.jobscheduler.domain.entity.JobSchedule;
import com.example.jobscheduler.dto.JobScheduleResponse;
import com.example.jobscheduler.dto.JobTypeResponse;
import com.example.jobscheduler.service.catalog.JobTypeDefinition;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobScheduleMapper {

    JobScheduleResponse toResponse(JobSchedule schedule);

    List<JobScheduleResponse> toResponseList(List<JobSchedule> schedules);

    /**
     * Routability depends on registered handlers and is filled in by the caller
     */
    @Mapping(target = "routable", ignore = true)
    JobTypeResponse toJobTypeResponse(JobTypeDefinition definition);
}
