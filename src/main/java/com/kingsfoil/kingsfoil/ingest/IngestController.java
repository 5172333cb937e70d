package com.kingsfoil.kingsfoil.ingest;

import com.kingsfoil.kingsfoil.source.DataSourceConfig;
import com.kingsfoil.kingsfoil.source.SourceRegistry;
import com.kingsfoil.kingsfoil.source.UnknownSourceException;
import com.kingsfoil.kingsfoil.version.DataVersion;
import com.kingsfoil.kingsfoil.version.VersionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * REST surface for source configuration, file ingestion and version management.
 */
@RestController
@RequestMapping("/api/sources")
public class IngestController {

    private final IngestService ingestService;
    private final SourceRegistry sourceRegistry;

    public IngestController(IngestService ingestService, SourceRegistry sourceRegistry) {
        this.ingestService = ingestService;
        this.sourceRegistry = sourceRegistry;
    }

    @GetMapping
    public ResponseEntity<List<DataSourceConfig>> listSources() {
        return ResponseEntity.ok(sourceRegistry.listSources());
    }

    @GetMapping("/{sourceCode}")
    public ResponseEntity<DataSourceConfig> getSource(@PathVariable String sourceCode) {
        return handle(() -> sourceRegistry.resolve(sourceCode));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DataSourceConfig> registerSource(@RequestBody DataSourceConfig config) {
        return handle(() -> sourceRegistry.register(config));
    }

    /**
     * Adds raw header aliases to one canonical column. Allowed even after versions reference the source.
     */
    @PostMapping(value = "/{sourceCode}/columns/{column}/aliases", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DataSourceConfig> addAliases(
            @PathVariable String sourceCode,
            @PathVariable String column,
            @RequestBody List<String> aliases) {
        return handle(() -> sourceRegistry.addAliases(sourceCode, column, aliases));
    }

    /**
     * Uploads one part of a version. Single-part sources omit {@code part} and {@code partCount}.
     */
    @PostMapping(value = "/{sourceCode}/versions/{versionLabel}/parts", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestResult> uploadPart(
            @PathVariable String sourceCode,
            @PathVariable String versionLabel,
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) String variant,
            @RequestParam(required = false) Integer part,
            @RequestParam(required = false) Integer partCount) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read uploaded file", ex);
        }
        return handle(() -> ingestService.ingestFile(
                sourceCode, variant, versionLabel, part, partCount, file.getOriginalFilename(), content));
    }

    @PostMapping("/{sourceCode}/versions/{versionLabel}/promote")
    public ResponseEntity<DataVersion> promote(
            @PathVariable String sourceCode,
            @PathVariable String versionLabel,
            @RequestParam(required = false) String variant) {
        return handle(() -> ingestService.promoteVersion(sourceCode, variant, versionLabel));
    }

    @GetMapping("/{sourceCode}/versions")
    public ResponseEntity<List<DataVersion>> listVersions(
            @PathVariable String sourceCode,
            @RequestParam(required = false) String variant) {
        return handle(() -> ingestService.listVersions(sourceCode, variant));
    }

    @GetMapping("/{sourceCode}/versions/{versionLabel}/issues")
    public ResponseEntity<List<ValidationIssue>> getVersionIssues(
            @PathVariable String sourceCode,
            @PathVariable String versionLabel,
            @RequestParam(required = false) String variant) {
        return handle(() -> ingestService.getVersionIssues(sourceCode, variant, versionLabel));
    }

    @GetMapping("/{sourceCode}/current")
    public ResponseEntity<List<Map<String, Object>>> getCurrentRows(
            @PathVariable String sourceCode,
            @RequestParam(required = false) String variant) {
        return handle(() -> ingestService.readCurrentRows(sourceCode, variant));
    }

    private static <T> ResponseEntity<T> handle(Supplier<T> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (UnknownSourceException | VersionNotFoundException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (IllegalStateException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        }
    }
}
