package com.fiscalbook.ledger.controller;

import com.fiscalbook.ledger.controller.dto.ApiResponseDto;
import com.fiscalbook.ledger.controller.dto.StatusChangeRequestDto;
import com.fiscalbook.ledger.service.FiscalBookService;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/fiscal-book/{bookId}")
public class FiscalBookController {

    private final FiscalBookService fiscalBookService;

    public FiscalBookController(FiscalBookService fiscalBookService) {
        this.fiscalBookService = fiscalBookService;
    }

    @PutMapping("/status")
    public ResponseEntity<ApiResponseDto<FiscalBookService.StatusChange>> changeStatus(
            @PathVariable("bookId") UUID bookId,
            @RequestBody @Valid StatusChangeRequestDto request
    ) {
        var change = fiscalBookService.changeStatus(bookId, request.status());
        return ResponseEntity.ok(ApiResponseDto.ok("Status updated successfully", change));
    }
}
