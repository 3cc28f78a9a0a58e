package com.megaproject.megaproject.raw;

import com.megaproject.megaproject.common.VerificationStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lists asset classes that have at least one registered raw table.
 */
@RestController
@RequestMapping("/api/asset-classes")
public class AssetClassController {

    private final RawTableService rawTableService;

    public AssetClassController(RawTableService rawTableService) {
        this.rawTableService = rawTableService;
    }

    @GetMapping
    public ResponseEntity<List<String>> listAssetClasses(@RequestParam(defaultValue = "true") boolean verified) {
        return ResponseEntity.ok(rawTableService.listAssetClasses(VerificationStatus.of(verified)));
    }
}
