package io.github.samzhu.prism.pool;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 以 JSON 檔案保存帳號
 *
 * <p>寫入時先寫到同目錄的暫存檔再以原子搬移取代原檔，讀取端不會看到寫到一半的內容。
 * 檔案不存在時視為空的帳號清單。
 */
public class JsonFileAccountStore implements AccountStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileAccountStore.class);

    private static final TypeReference<List<AccountSnapshot>> SNAPSHOT_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileAccountStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<AccountSnapshot> load() throws IOException {
        if (!Files.exists(file)) {
            log.info("Account store file not found, starting empty: {}", file);
            return List.of();
        }
        List<AccountSnapshot> snapshots = objectMapper.readValue(file.toFile(), SNAPSHOT_LIST);
        return snapshots != null ? snapshots : List.of();
    }

    @Override
    public synchronized void save(List<AccountSnapshot> snapshots) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshots);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Saved {} account(s) to {}", snapshots.size(), file);
    }

    public Path getFile() {
        return file;
    }
}
