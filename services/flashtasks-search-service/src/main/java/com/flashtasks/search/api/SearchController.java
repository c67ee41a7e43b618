package com.flashtasks.search.api;

import com.flashtasks.search.api.dto.SearchRequest;
import com.flashtasks.search.api.dto.SearchResponse;
import com.flashtasks.search.common.BadRequestException;
import com.flashtasks.search.common.RequestContextHolder;
import com.flashtasks.search.opensearch.OpenSearchUnavailableException;
import com.flashtasks.search.service.SearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private static final Logger logger = LoggerFactory.getLogger(SearchController.class);

    private final SearchService searchService;

    public SearchController(SearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping({"/search", "/api/search"})
    public ResponseEntity<SearchResponse> search(@RequestBody(required = false) SearchRequest request) {
        try {
            return ResponseEntity.ok(searchService.search(request));
        } catch (BadRequestException e) {
            return ResponseEntity.badRequest().body(SearchResponse.error(e.getCode()));
        } catch (OpenSearchUnavailableException e) {
            logger.error("search_failed request_id={} error={}", RequestContextHolder.requestId(), e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(SearchResponse.error("store_unavailable"));
        } catch (Exception e) {
            logger.error("search_failed request_id={}", RequestContextHolder.requestId(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(SearchResponse.error("search_failed"));
        }
    }
}
