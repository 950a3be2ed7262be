package com.example.identityapi.dto;

import org.springframework.data.domain.Page;

/**
 * Paging information returned alongside list responses. Pages are 1-based.
 */
public record PaginationMetadata(
    long totalCount,
    int pageSize,
    int currentPage,
    int totalPages
) {
    public static PaginationMetadata from(Page<?> page) {
        return new PaginationMetadata(
            page.getTotalElements(),
            page.getSize(),
            page.getNumber() + 1,
            page.getTotalPages()
        );
    }
}
