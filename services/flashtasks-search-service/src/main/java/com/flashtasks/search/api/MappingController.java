package com.flashtasks.search.api;

import com.flashtasks.search.api.dto.MappingsResponse;
import com.flashtasks.search.common.ErrorResponse;
import com.flashtasks.search.common.RequestContextHolder;
import com.flashtasks.search.opensearch.OpenSearchRequestException;
import com.flashtasks.search.opensearch.OpenSearchUnavailableException;
import com.flashtasks.search.service.MappingInspectionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MappingController {
    private final MappingInspectionService mappingInspectionService;

    public MappingController(MappingInspectionService mappingInspectionService) {
        this.mappingInspectionService = mappingInspectionService;
    }

    @GetMapping("/mappings")
    public ResponseEntity<?> mappings(
        @RequestParam(value = "index", required = false) String index,
        @RequestParam(value = "refresh", defaultValue = "false") boolean refresh
    ) {
        try {
            MappingsResponse response = mappingInspectionService.describe(index, refresh);
            return ResponseEntity.ok(response);
        } catch (OpenSearchUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(error("store_unavailable", "OpenSearch is unavailable"));
        } catch (OpenSearchRequestException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error("mapping_failed", e.getMessage()));
        }
    }

    private ErrorResponse error(String code, String message) {
        return new ErrorResponse(code, message, RequestContextHolder.traceId(), RequestContextHolder.requestId());
    }
}
