package me.golemcore.otp.adapter.outbound.storage;

import me.golemcore.otp.infrastructure.config.OtpProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String TOKENS = "tokens";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        OtpProperties properties = new OtpProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void init_createsRecordDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("tokens")));
        assertTrue(Files.isDirectory(tempDir.resolve("users")));
    }

    @Test
    void putTextAtomicAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TOKENS, "abc.json", "{\"a\":1}", false).get();

        assertEquals("{\"a\":1}", storageAdapter.getText(TOKENS, "abc.json").get());
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(TOKENS, "missing.json").get());
    }

    @Test
    void putTextAtomic_keepsBackupOfPreviousVersion() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TOKENS, "abc.json", "v1", true).get();
        storageAdapter.putTextAtomic(TOKENS, "abc.json", "v2", true).get();

        assertEquals("v2", storageAdapter.getText(TOKENS, "abc.json").get());
        assertEquals("v1", storageAdapter.getText(TOKENS, "abc.json.bak").get());
        assertFalse(storageAdapter.exists(TOKENS, "abc.json.tmp").get());
    }

    @Test
    void deleteObject_removesFile() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TOKENS, "gone.json", "x", false).get();
        assertTrue(storageAdapter.exists(TOKENS, "gone.json").get());

        storageAdapter.deleteObject(TOKENS, "gone.json").get();

        assertFalse(storageAdapter.exists(TOKENS, "gone.json").get());
    }

    @Test
    void listObjects_returnsSortedRelativePaths() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(TOKENS, "b.json", "b", false).get();
        storageAdapter.putTextAtomic(TOKENS, "a.json", "a", false).get();

        List<String> files = storageAdapter.listObjects(TOKENS, "").get();

        assertEquals(List.of("a.json", "b.json"), files);
    }

    @Test
    void listObjects_returnsEmptyForMissingDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("nowhere", "").get().isEmpty());
    }

    // ==================== Path traversal ====================

    @Test
    void shouldBlockPathTraversal() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic(TOKENS, "../../etc/passwd", "hack", false).get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void shouldBlockPathTraversalOnGet() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(TOKENS, "../../../secret").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }
}
