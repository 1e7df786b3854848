package me.subaru.bot.adapter.outbound.storage;

import me.subaru.bot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String SESSIONS = "sessions";
    private static final String CONTENT_DEFAULT = "{\"user_id\":\"@alice:example.org\"}";
    private static final String FILE_1 = "_alice_example.org.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesKnownDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("sessions")));
        assertTrue(Files.isDirectory(tempDir.resolve("downloads")));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, FILE_1, CONTENT_DEFAULT, false).get();

        assertEquals(CONTENT_DEFAULT, storageAdapter.getText(SESSIONS, FILE_1).get());
        assertFalse(Files.exists(tempDir.resolve(SESSIONS).resolve(FILE_1 + ".tmp")));
    }

    @Test
    void getText_returnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(SESSIONS, "missing.json").get());
    }

    @Test
    void putTextAtomic_overwritesExistingFile() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, FILE_1, "{}", false).get();
        storageAdapter.putTextAtomic(SESSIONS, FILE_1, CONTENT_DEFAULT, false).get();

        assertEquals(CONTENT_DEFAULT, storageAdapter.getText(SESSIONS, FILE_1).get());
        assertFalse(Files.exists(tempDir.resolve(SESSIONS).resolve(FILE_1 + ".bak")));
    }

    @Test
    void putTextAtomic_keepsBackupOfPreviousVersion() throws Exception {
        storageAdapter.putTextAtomic("downloads", "jobs.json", "[1]", true).get();
        storageAdapter.putTextAtomic("downloads", "jobs.json", "[1,2]", true).get();

        assertEquals("[1,2]", storageAdapter.getText("downloads", "jobs.json").get());
        assertEquals("[1]", Files.readString(tempDir.resolve("downloads").resolve("jobs.json.bak"),
                StandardCharsets.UTF_8));
    }

    @Test
    void listObjects_skipsBackupFiles() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, "b.json", "{}", true).get();
        storageAdapter.putTextAtomic(SESSIONS, "b.json", "{}", true).get();
        storageAdapter.putTextAtomic(SESSIONS, "a.json", "{}", false).get();

        List<String> names = storageAdapter.listObjects(SESSIONS, "").get();

        assertEquals(List.of("a.json", "b.json"), names);
    }

    @Test
    void listObjects_filtersByPrefix() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(SESSIONS, "_alice_example.org.json", "{}", false).get();
        storageAdapter.putTextAtomic(SESSIONS, "_bob_example.org.json", "{}", false).get();

        assertEquals(List.of("_alice_example.org.json"), storageAdapter.listObjects(SESSIONS, "_alice").get());
    }

    @Test
    void listObjects_emptyForMissingDirectory() throws ExecutionException, InterruptedException {
        assertTrue(storageAdapter.listObjects("unknown", "").get().isEmpty());
    }

    @Test
    void pathTraversalIsBlocked() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(SESSIONS, "../../etc/passwd").get());

        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }
}
