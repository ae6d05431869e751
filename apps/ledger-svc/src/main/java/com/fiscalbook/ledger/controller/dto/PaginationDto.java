package com.fiscalbook.ledger.controller.dto;

public record PaginationDto(long total, int limit, int skip, boolean hasMore) {

    public static PaginationDto of(long total, int returned, Integer limit, Integer skip) {
        int offset = skip == null ? 0 : skip;
        int size = limit == null ? returned : limit;
        return new PaginationDto(total, size, offset, offset + returned < total);
    }
}
