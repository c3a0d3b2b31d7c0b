package com.example.checkout.infrastructure.adapter.in.web;

import com.example.checkout.application.port.in.AdjustStockUseCase;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.StockUnitRef;
import com.example.checkout.infrastructure.adapter.in.web.dto.StockUpdateRequest;
import com.example.checkout.infrastructure.adapter.in.web.dto.StockUpdateResponse;
import com.example.checkout.infrastructure.adapter.in.web.mapper.CheckoutWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.UUID;

/**
 * Back-office stock edits. Access control is enforced by the gateway.
 */
@RestController
@RequestMapping("/api/admin/stock")
@Tag(name = "Admin Stock", description = "後台庫存調整 API")
public class AdminStockController {

    private static final Logger log = LoggerFactory.getLogger(AdminStockController.class);

    private final AdjustStockUseCase adjustStockUseCase;
    private final CheckoutWebMapper mapper;

    public AdminStockController(AdjustStockUseCase adjustStockUseCase, CheckoutWebMapper mapper) {
        this.adjustStockUseCase = adjustStockUseCase;
        this.mapper = mapper;
    }

    @Operation(summary = "設定庫存數量", description = "於資料列鎖下設定絕對數量，並寫入稽核紀錄")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "更新成功"),
            @ApiResponse(responseCode = "400", description = "數量為負或單位類型錯誤")
    })
    @PutMapping("/{unitType}/{unitId}")
    public Mono<StockUpdateResponse> setStock(
            @RequestHeader("X-User-Id") UUID adminId,
            @Parameter(description = "product 或 variant", required = true)
            @PathVariable String unitType,
            @PathVariable UUID unitId,
            @Valid @RequestBody StockUpdateRequest request) {
        StockUnitRef unit = mapper.toStockUnit(unitType, unitId);
        log.info("Admin {} setting stock of {} to {}", adminId, unit, request.quantity());
        return Mono.fromCallable(() -> adjustStockUseCase.setStock(unit, request.quantity(), Actor.user(adminId)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(mapper::toResponse);
    }
}
