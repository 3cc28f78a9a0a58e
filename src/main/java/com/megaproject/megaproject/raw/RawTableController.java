package com.megaproject.megaproject.raw;

import com.megaproject.megaproject.common.ApiExceptions;
import com.megaproject.megaproject.common.Identifiers;
import com.megaproject.megaproject.common.VerificationStatus;
import com.megaproject.megaproject.table.TableQueryService;
import com.megaproject.megaproject.table.TableResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Upload, inspection and removal of raw tables.
 */
@RestController
@RequestMapping("/api/raw-tables")
public class RawTableController {

    private final RawTableService rawTableService;
    private final TableQueryService tableQueryService;

    public RawTableController(RawTableService rawTableService, TableQueryService tableQueryService) {
        this.rawTableService = rawTableService;
        this.tableQueryService = tableQueryService;
    }

    @GetMapping
    public ResponseEntity<List<RawTableEntry>> listRawTables(@RequestParam(defaultValue = "true") boolean verified) {
        return ResponseEntity.ok(rawTableService.listRawTables(VerificationStatus.of(verified)));
    }

    /**
     * Loads a CSV file as raw table {@code table} of {@code assetClass}, replacing any previous version.
     */
    @PostMapping(value = "/{assetClass}/{table}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RawLoadResult> uploadRawTable(@PathVariable String assetClass,
                                                        @PathVariable String table,
                                                        @RequestParam(defaultValue = "true") boolean verified,
                                                        @RequestParam("file") MultipartFile file) {
        try {
            return ResponseEntity.ok(
                    rawTableService.loadCsv(assetClass, VerificationStatus.of(verified), table, file.getBytes()));
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Failed to read uploaded file", ex);
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to load raw table " + table);
        }
    }

    @GetMapping("/{table}")
    public ResponseEntity<TableResponse> getRawTable(@PathVariable String table,
                                                     @RequestParam(defaultValue = "true") boolean verified) {
        try {
            Identifiers.requireTableName(table, "table");
            return ResponseEntity.ok(tableQueryService.select(VerificationStatus.of(verified).rawSchema(), table));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to read raw table " + table);
        }
    }

    @GetMapping("/{table}/record")
    public ResponseEntity<Map<String, String>> getRawRecord(@PathVariable String table,
                                                            @RequestParam String projectId,
                                                            @RequestParam String sample,
                                                            @RequestParam(defaultValue = "true") boolean verified) {
        try {
            Identifiers.requireTableName(table, "table");
            return ResponseEntity.ok(tableQueryService.selectById(
                    VerificationStatus.of(verified).rawSchema(), table, projectId, sample));
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to read raw record");
        }
    }

    @PostMapping("/{table}/record")
    public ResponseEntity<Void> addRawRecord(@PathVariable String table,
                                             @RequestBody RawRecordRequest record,
                                             @RequestParam(defaultValue = "true") boolean verified) {
        try {
            rawTableService.addRecord(VerificationStatus.of(verified), table,
                    record.projectId(), record.sample(), record.data());
            return ResponseEntity.noContent().build();
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to add raw record");
        }
    }

    @PutMapping("/{table}/record")
    public ResponseEntity<Void> updateRawRecord(@PathVariable String table,
                                                @RequestBody RawRecordRequest record,
                                                @RequestParam(defaultValue = "true") boolean verified) {
        try {
            rawTableService.updateRecord(VerificationStatus.of(verified), table,
                    record.projectId(), record.sample(), record.data());
            return ResponseEntity.noContent().build();
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to update raw record");
        }
    }

    @DeleteMapping("/{table}/record")
    public ResponseEntity<Void> deleteRawRecord(@PathVariable String table,
                                                @RequestParam String projectId,
                                                @RequestParam String sample,
                                                @RequestParam(defaultValue = "true") boolean verified) {
        try {
            rawTableService.deleteRecord(VerificationStatus.of(verified), table, projectId, sample);
            return ResponseEntity.noContent().build();
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to delete raw record");
        }
    }

    @DeleteMapping("/{table}")
    public ResponseEntity<Void> deleteRawTable(@PathVariable String table,
                                               @RequestParam(defaultValue = "true") boolean verified) {
        try {
            rawTableService.deleteRawTable(VerificationStatus.of(verified), table);
            return ResponseEntity.noContent().build();
        } catch (RuntimeException ex) {
            throw ApiExceptions.translate(ex, "Failed to delete raw table " + table);
        }
    }
}
