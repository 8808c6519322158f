package com.starscape.taskboard.common.pagination;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Objects;

/**
 * Pageable addressed by a raw row offset instead of a page number.
 * Offsets do not have to be a multiple of the limit.
 */
public class OffsetLimitRequest implements Pageable {
    
    private final long offset;
    private final int limit;
    private final Sort sort;
    
    public OffsetLimitRequest(long offset, int limit, Sort sort) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1");
        }
        this.offset = offset;
        this.limit = limit;
        this.sort = sort != null ? sort : Sort.unsorted();
    }
    
    public static OffsetLimitRequest of(long offset, int limit, Sort sort) {
        return new OffsetLimitRequest(offset, limit, sort);
    }
    
    @Override
    public int getPageNumber() {
        return (int) (offset / limit);
    }
    
    @Override
    public int getPageSize() {
        return limit;
    }
    
    @Override
    public long getOffset() {
        return offset;
    }
    
    @Override
    public Sort getSort() {
        return sort;
    }
    
    @Override
    public Pageable next() {
        return new OffsetLimitRequest(offset + limit, limit, sort);
    }
    
    @Override
    public Pageable previousOrFirst() {
        return hasPrevious() ? new OffsetLimitRequest(Math.max(0, offset - limit), limit, sort) : first();
    }
    
    @Override
    public Pageable first() {
        return new OffsetLimitRequest(0, limit, sort);
    }
    
    @Override
    public Pageable withPage(int pageNumber) {
        return new OffsetLimitRequest((long) pageNumber * limit, limit, sort);
    }
    
    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OffsetLimitRequest that = (OffsetLimitRequest) o;
        return offset == that.offset && limit == that.limit && sort.equals(that.sort);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(offset, limit, sort);
    }
    
    @Override
    public String toString() {
        return "OffsetLimitRequest[offset=" + offset + ", limit=" + limit + ", sort=" + sort + "]";
    }
}
