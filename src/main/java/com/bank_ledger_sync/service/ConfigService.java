package com.bank_ledger_sync.service;

import com.bank_ledger_sync.config.AggregatorProperties;
import com.bank_ledger_sync.exception.ConfigException;
import com.bank_ledger_sync.model.ImportConfig;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.function.UnaryOperator;

@Slf4j
@Service
public class ConfigService {

    private final ObjectMapper mapper;
    private final ObjectWriter writer;
    private final Path path;

    public ConfigService(ObjectMapper objectMapper, AggregatorProperties props) {
        this.mapper = objectMapper;
        // sorted keys, 4 space indent: same layout as config files written by earlier importers
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(new DefaultIndenter("    ", DefaultIndenter.SYS_LF));
        this.writer = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .writer(printer);
        this.path = Path.of(props.getConfigPath());
    }

    public synchronized ImportConfig load() {
        if (!Files.exists(path)) {
            log.info("No config at {}, starting empty", path);
            return new ImportConfig();
        }
        try {
            ImportConfig config = mapper.readValue(path.toFile(), ImportConfig.class);
            if (config.getAccounts() == null) {
                config.setAccounts(new LinkedHashMap<>());
            }
            return config;
        } catch (IOException e) {
            throw new ConfigException("Cannot read config " + path, e);
        }
    }

    public synchronized void save(ImportConfig config) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            writer.writeValue(path.toFile(), config);
        } catch (IOException e) {
            throw new ConfigException("Cannot write config " + path, e);
        }
        log.debug("Config written to {}", path);
    }

    public synchronized ImportConfig update(UnaryOperator<ImportConfig> change) {
        ImportConfig updated = change.apply(load());
        save(updated);
        return updated;
    }
}
