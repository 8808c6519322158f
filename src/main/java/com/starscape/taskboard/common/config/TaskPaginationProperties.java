package com.starscape.taskboard.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for task list pagination.
 * Binds to app.tasks.pagination.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.tasks.pagination")
public class TaskPaginationProperties {
    
    private int defaultLimit = 20;
    private int maxLimit = 100;
    
    public int getDefaultLimit() {
        return defaultLimit;
    }
    
    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }
    
    public int getMaxLimit() {
        return maxLimit;
    }
    
    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }
    
    /**
     * Resolve the effective page size for a request.
     * Falls back to the default when no limit was given and caps the result at maxLimit.
     * @param requested The limit from the request, may be null
     * @return a limit between 1 and maxLimit
     */
    public int resolveLimit(Integer requested) {
        int limit = requested != null ? requested : defaultLimit;
        return Math.max(1, Math.min(limit, maxLimit));
    }
}
