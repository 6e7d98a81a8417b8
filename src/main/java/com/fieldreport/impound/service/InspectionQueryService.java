package com.fieldreport.impound.service;

import com.fieldreport.impound.exception.InspectionNotFoundException;
import com.fieldreport.impound.exception.StoreUnavailableException;
import com.fieldreport.impound.model.Inspection;
import com.fieldreport.impound.model.ReleaseRecord;
import com.fieldreport.impound.repository.InspectionRepository;
import com.fieldreport.impound.repository.ReleaseRecordRepository;
import com.fieldreport.impound.repository.StoreRetryPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * Read side: inspection list, detail and release history.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InspectionQueryService {

    private final InspectionRepository inspectionRepository;
    private final ReleaseRecordRepository releaseRepository;
    private final StoreRetryPolicy retryPolicy;

    public List<Inspection> list(String filter) {
        return read("findAllInspections", () -> inspectionRepository.findAll(filter));
    }

    public Inspection get(String inspectionId) {
        return read("findInspectionById", () -> inspectionRepository.findById(inspectionId))
                .orElseThrow(() -> new InspectionNotFoundException(inspectionId));
    }

    /**
     * Releases of one inspection, newest first.
     */
    public List<ReleaseRecord> releases(String inspectionId) {
        get(inspectionId);
        return read("findReleasesByInspection", () -> releaseRepository.findByInspection(inspectionId));
    }

    private <T> T read(String operation, Supplier<T> query) {
        try {
            return retryPolicy.execute(operation, query);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("The inspection store is unavailable", e);
        }
    }
}
