package com.example.jobscheduler.mapper;

import com.example.jobscheduler.domain.entity.FailedSnapshot;
import com.example.jobscheduler.dto.FailedSnapshotResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface FailedSnapshotMapper {

    FailedSnapshotResponse toResponse(FailedSnapshot snapshot);

    List<FailedSnapshotResponse> toResponseList(List<FailedSnapshot> snapshots);
}
