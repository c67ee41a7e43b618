package com.flashtasks.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {
    private List<Map<String, Object>> results = Collections.emptyList();
    private Debug debug;
    private String error;

    public static SearchResponse empty() {
        return new SearchResponse();
    }

    public static SearchResponse error(String code) {
        SearchResponse response = new SearchResponse();
        response.setError(code);
        return response;
    }

    public List<Map<String, Object>> getResults() {
        return results;
    }

    public void setResults(List<Map<String, Object>> results) {
        this.results = results == null ? Collections.emptyList() : results;
    }

    public Debug getDebug() {
        return debug;
    }

    public void setDebug(Debug debug) {
        this.debug = debug;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    /**
     * Hits with and without the visibility filter, to tell "no textual match" from "filtered out".
     */
    public static class Debug {
        private final List<Map<String, Object>> filtered;
        private final List<Map<String, Object>> unfiltered;

        public Debug(List<Map<String, Object>> filtered, List<Map<String, Object>> unfiltered) {
            this.filtered = filtered;
            this.unfiltered = unfiltered;
        }

        public List<Map<String, Object>> getFiltered() {
            return filtered;
        }

        public List<Map<String, Object>> getUnfiltered() {
            return unfiltered;
        }
    }
}
