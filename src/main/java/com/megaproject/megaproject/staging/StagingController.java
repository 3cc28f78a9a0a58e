package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.common.ApiExceptions;
import com.megaproject.megaproject.common.VerificationStatus;
import com.megaproject.megaproject.table.TableResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Stage runs and staged table reads, one asset class at a time.
 */
@RestController
@RequestMapping("/api/stage")
public class StagingController {

    private final StagingService stagingService;

    public StagingController(StagingService stagingService) {
        this.stagingService = stagingService;
    }

    /**
     * Rebuilds the staged table of an asset class from its current raw tables.
     */
    @PostMapping("/{assetClass}")
    public ResponseEntity<StageResult> stage(@PathVariable String assetClass,
                                             @RequestParam(defaultValue = "true") boolean verified) {
        try {
            return ResponseEntity.ok(stagingService.stage(assetClass, VerificationStatus.of(verified)));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to stage asset class " + assetClass);
        }
    }

    @DeleteMapping("/{assetClass}")
    public ResponseEntity<Void> deleteStage(@PathVariable String assetClass,
                                            @RequestParam(defaultValue = "true") boolean verified) {
        try {
            stagingService.deleteStage(assetClass, VerificationStatus.of(verified));
            return ResponseEntity.noContent().build();
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to delete staged table " + assetClass);
        }
    }

    @GetMapping("/{assetClass}")
    public ResponseEntity<TableResponse> getStage(@PathVariable String assetClass,
                                                  @RequestParam(defaultValue = "true") boolean verified) {
        try {
            return ResponseEntity.ok(stagingService.selectStage(assetClass, VerificationStatus.of(verified)));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to read staged table " + assetClass);
        }
    }

    @GetMapping("/{assetClass}/ratio-fields")
    public ResponseEntity<List<String>> getRatioFields(@PathVariable String assetClass,
                                                       @RequestParam(defaultValue = "true") boolean verified) {
        try {
            return ResponseEntity.ok(stagingService.ratioFields(assetClass, VerificationStatus.of(verified)));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to list ratio fields of " + assetClass);
        }
    }

    @GetMapping("/{assetClass}/record")
    public ResponseEntity<Map<String, String>> getStageRecord(@PathVariable String assetClass,
                                                              @RequestParam String projectId,
                                                              @RequestParam String sample,
                                                              @RequestParam(defaultValue = "true") boolean verified) {
        try {
            return ResponseEntity.ok(stagingService.selectStageRecord(
                    assetClass, VerificationStatus.of(verified), projectId, sample));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to read staged record");
        }
    }
}
