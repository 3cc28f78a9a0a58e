package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.common.ApiExceptions;
import com.megaproject.megaproject.common.VerificationStatus;
import com.megaproject.megaproject.table.TableResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Promotion into, and reads from, the production tables.
 */
@RestController
@RequestMapping("/api/prod")
public class ProductionController {

    private final StagingService stagingService;

    public ProductionController(StagingService stagingService) {
        this.stagingService = stagingService;
    }

    @PostMapping("/promote")
    public ResponseEntity<StageResult> promote(@RequestParam(defaultValue = "true") boolean verified) {
        try {
            return ResponseEntity.ok(stagingService.promote(VerificationStatus.of(verified)));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to promote staged tables");
        }
    }

    @GetMapping
    public ResponseEntity<TableResponse> getProd(@RequestParam(defaultValue = "true") boolean verified) {
        try {
            return ResponseEntity.ok(stagingService.selectProd(VerificationStatus.of(verified)));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to read production table");
        }
    }

    @GetMapping("/record")
    public ResponseEntity<Map<String, String>> getProdRecord(@RequestParam String projectId,
                                                             @RequestParam String sample,
                                                             @RequestParam(defaultValue = "true") boolean verified) {
        try {
            return ResponseEntity.ok(stagingService.selectProdRecord(VerificationStatus.of(verified), projectId, sample));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to read production record");
        }
    }
}
