package com.rideshare.reputation.service;

import com.rideshare.reputation.config.ReputationConfig;

import java.util.Map;

/**
 * Validated page-number pagination. Problems are collected into {@code errors}
 * so callers can report them together with their own field errors.
 */
record PageRequest(int page, int pageSize) {

    static PageRequest resolve(Integer page, Integer pageSize, ReputationConfig.Paging paging,
                               Map<String, String> errors) {
        int resolvedPage = page != null ? page : 1;
        int resolvedPageSize = pageSize != null ? pageSize : paging.getDefaultPageSize();

        if (resolvedPage < 1) {
            errors.put("page", "must be at least 1");
        }
        if (resolvedPageSize < 1 || resolvedPageSize > paging.getMaxPageSize()) {
            errors.put("pageSize", "must be between 1 and " + paging.getMaxPageSize());
        }
        return new PageRequest(resolvedPage, resolvedPageSize);
    }
}
