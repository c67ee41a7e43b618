package com.flashtasks.search.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.flashtasks.search.api.dto.IndexResponse;
import com.flashtasks.search.common.BadRequestException;
import com.flashtasks.search.common.RequestContextHolder;
import com.flashtasks.search.common.UnauthorizedException;
import com.flashtasks.search.ingest.ReconcileResult;
import com.flashtasks.search.opensearch.OpenSearchConflictException;
import com.flashtasks.search.opensearch.OpenSearchUnavailableException;
import com.flashtasks.search.service.IndexRoute;
import com.flashtasks.search.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class IndexController {
    private static final Logger logger = LoggerFactory.getLogger(IndexController.class);

    private final IndexingService indexingService;

    public IndexController(IndexingService indexingService) {
        this.indexingService = indexingService;
    }

    @PostMapping("/index/task")
    public ResponseEntity<IndexResponse> indexTask(
        @RequestBody(required = false) JsonNode body,
        @RequestHeader HttpHeaders headers
    ) {
        return handle(body, headers, IndexRoute.TASK);
    }

    @PostMapping("/index/organization")
    public ResponseEntity<IndexResponse> indexOrganization(
        @RequestBody(required = false) JsonNode body,
        @RequestHeader HttpHeaders headers
    ) {
        return handle(body, headers, IndexRoute.ORGANIZATION);
    }

    @PostMapping({"/index", "/api/index"})
    public ResponseEntity<IndexResponse> index(
        @RequestBody(required = false) JsonNode body,
        @RequestHeader HttpHeaders headers
    ) {
        return handle(body, headers, IndexRoute.ANY);
    }

    private ResponseEntity<IndexResponse> handle(JsonNode body, HttpHeaders headers, IndexRoute route) {
        String requestId = RequestContextHolder.requestId();
        try {
            ReconcileResult result = indexingService.index(body, headers, route);
            return ResponseEntity.ok(IndexResponse.of(result, requestId));
        } catch (BadRequestException e) {
            return ResponseEntity.badRequest().body(IndexResponse.error(e.getCode(), requestId));
        } catch (UnauthorizedException e) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(IndexResponse.error("unauthorized", requestId));
        } catch (OpenSearchConflictException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(IndexResponse.error("concurrent_modification", requestId));
        } catch (OpenSearchUnavailableException e) {
            logger.error("index_failed route={} request_id={} error={}", route, requestId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(IndexResponse.error("store_unavailable", requestId));
        } catch (Exception e) {
            logger.error("index_failed route={} request_id={}", route, requestId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(IndexResponse.error("index_failed", requestId));
        }
    }
}
