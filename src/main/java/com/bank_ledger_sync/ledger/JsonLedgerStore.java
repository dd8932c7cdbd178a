package com.bank_ledger_sync.ledger;

import com.bank_ledger_sync.exception.LedgerIoException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

// saves go to a sibling temp file that is then moved over the original
@Slf4j
@Component
public class JsonLedgerStore implements LedgerStore {

    private final ObjectMapper mapper;

    public JsonLedgerStore(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public LedgerSession open(Path file) {
        Path path = expandHome(file);
        LedgerBook book;
        try {
            book = mapper.readValue(path.toFile(), LedgerBook.class);
        } catch (IOException e) {
            throw new LedgerIoException(path, e);
        }
        log.debug("Opened ledger {} with {} entries", path, book.getEntries().size());
        return new LedgerBookSession(book, path, b -> write(path, b));
    }

    private void write(Path path, LedgerBook book) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), book);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new LedgerIoException(path, e);
        }
        log.info("Saved ledger {}", path);
    }

    static Path expandHome(Path file) {
        String raw = file.toString();
        if (raw.equals("~") || raw.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + raw.substring(1));
        }
        return file;
    }
}
