package com.govsync.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Import audit trail stored as one compact JSON object per line.
 *
 * Each line carries the hash of its predecessor ({@code prevHash}) and its own SHA-256
 * ({@code hash}) computed over the line without the {@code hash} field, so editing or
 * removing any line breaks the chain from that point on.
 */
public class JsonLinesImportAuditLog implements ImportAuditLog {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesImportAuditLog.class);

    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final Path file;
    private final int recentLimit;
    private String previousHash;

    public JsonLinesImportAuditLog(Path file, int recentLimit) {
        this.file = file;
        this.recentLimit = Math.max(1, recentLimit);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(file)) {
                Files.createFile(file);
            }
        } catch (IOException ex) {
            throw new AuditLogException("failed to initialize audit log " + file, ex);
        }
        this.previousHash = loadLastHash();
    }

    @Override
    public synchronized ImportRecord append(ImportRecord record) {
        Map<String, Object> row = toRow(record);
        row.put("prevHash", previousHash);
        String hash = sha256(toJson(row));
        row.put("hash", hash);
        try {
            Files.writeString(file, toJson(row) + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException ex) {
            throw new AuditLogException("failed to append to audit log " + file, ex);
        }
        ImportRecord stored = record.chained(previousHash, hash);
        previousHash = hash;
        log.debug("Audited {} {} as {}", record.operation(), record.fingerprint(), record.status().getValue());
        return stored;
    }

    @Override
    public synchronized List<ImportRecord> recent(int n) {
        int limit = Math.min(Math.max(n, 0), recentLimit);
        List<String> lines = readLines();
        List<ImportRecord> result = new ArrayList<>();
        for (int i = lines.size() - 1; i >= 0 && result.size() < limit; i--) {
            result.add(fromRow(parse(lines.get(i))));
        }
        return result;
    }

    @Override
    public synchronized ChainVerification verifyChain() {
        List<String> lines = readLines();
        String expectedPrev = "";
        for (int i = 0; i < lines.size(); i++) {
            LinkedHashMap<String, Object> row;
            try {
                row = mapper.readValue(lines.get(i), ROW_TYPE);
            } catch (JsonProcessingException ex) {
                log.warn("Audit line {} is not valid JSON", i + 1);
                return new ChainVerification(false, lines.size(), i + 1);
            }
            Object storedHash = row.remove("hash");
            String recomputed = sha256(toJson(row));
            if (!Objects.equals(expectedPrev, row.get("prevHash")) || !recomputed.equals(storedHash)) {
                log.warn("Audit chain broken at line {}", i + 1);
                return new ChainVerification(false, lines.size(), i + 1);
            }
            expectedPrev = recomputed;
        }
        return new ChainVerification(true, lines.size(), 0);
    }

    public Path getFile() {
        return file;
    }

    private Map<String, Object> toRow(ImportRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("fingerprint", record.fingerprint());
        row.put("timestamp", record.timestamp() != null ? record.timestamp().toString() : null);
        row.put("operation", record.operation());
        row.put("recordCount", record.recordCount());
        row.put("status", record.status().getValue());
        // plain JSON values only, so the hash survives a parse and re-serialize
        row.put("details", mapper.convertValue(record.details(), Object.class));
        row.put("errorMessage", record.errorMessage());
        row.put("submittedBy", record.submittedBy());
        return row;
    }

    @SuppressWarnings("unchecked")
    private ImportRecord fromRow(Map<String, Object> row) {
        Object timestamp = row.get("timestamp");
        Object count = row.get("recordCount");
        Object details = row.get("details");
        return new ImportRecord(
            (String) row.get("fingerprint"),
            timestamp != null ? Instant.parse(timestamp.toString()) : null,
            (String) row.get("operation"),
            count instanceof Number number ? number.intValue() : 0,
            ImportStatus.fromValue(String.valueOf(row.get("status"))),
            details instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of(),
            (String) row.get("errorMessage"),
            (String) row.get("submittedBy"),
            (String) row.get("prevHash"),
            (String) row.get("hash")
        );
    }

    private LinkedHashMap<String, Object> parse(String line) {
        try {
            return mapper.readValue(line, ROW_TYPE);
        } catch (JsonProcessingException ex) {
            throw new AuditLogException("corrupt audit line in " + file, ex);
        }
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                .filter(line -> !line.isBlank())
                .toList();
        } catch (IOException ex) {
            throw new AuditLogException("failed to read audit log " + file, ex);
        }
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        Object hash = parse(lines.get(lines.size() - 1)).get("hash");
        return hash != null ? hash.toString() : "";
    }

    private String toJson(Map<String, Object> row) {
        try {
            return mapper.writeValueAsString(row);
        } catch (JsonProcessingException ex) {
            throw new AuditLogException("failed to serialize audit row", ex);
        }
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
