package com.pipeline.battery;

import com.pipeline.battery.model.IngestionRequest;
import com.pipeline.battery.model.IngestionRun;
import com.pipeline.battery.model.IngestionStatus;
import com.pipeline.battery.storage.DatabaseLockedException;
import com.pipeline.battery.storage.DbSyncManager;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static com.pipeline.battery.TestFrames.fixture;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class BatteryEtlApplicationTest {

    @TempDir
    Path tempDir;

    private String[] args() throws IOException {
        Path step = Files.write(tempDir.resolve("step.csv"), fixture("step.csv"));
        Path detail = Files.write(tempDir.resolve("detail.csv"), fixture("detail.csv"));
        return new String[]{"unused.properties", step.toString(), detail.toString(), "cli-run", "5.0", "2"};
    }

    private AppConfig config(Properties extra) {
        Properties props = new Properties();
        props.setProperty("storage.root", tempDir.resolve("store").toString());
        props.setProperty("dedup.retry.delay.ms", "0");
        props.putAll(extra);
        return AppConfig.fromProperties(props);
    }

    @Test
    void parseRequestReadsFilesAndOptionalInterval() throws IOException {
        IngestionRequest request = BatteryEtlApplication.parseRequest(args());

        assertThat(request.getStepFile().getFilename()).isEqualTo("step.csv");
        assertThat(request.getDetailFile().size()).isEqualTo(fixture("detail.csv").length);
        assertThat(request.getMetadata().getName()).isEqualTo("cli-run");
        assertThat(request.getNominalCapacity()).isEqualTo(5.0);
        assertThat(request.getIntervalSeconds()).isEqualTo(2.0);
        assertThat(request.getSelectedStepNumbers()).isEmpty();
    }

    @Test
    void runOnceWithLocalStore() throws IOException {
        AppConfig config = config(new Properties());

        IngestionRun run = BatteryEtlApplication.runOnce(config, BatteryEtlApplication.parseRequest(args()));

        assertThat(run.getStatus()).isEqualTo(IngestionStatus.COMPLETED);
        assertThat(tempDir.resolve("store").resolve("battery.db")).exists();
    }

    @Test
    void runOnceWithSharedStoreUploadsAndReleasesLock() throws IOException {
        Path shared = tempDir.resolve("share").resolve("battery.db");
        Path local = tempDir.resolve("local").resolve("battery.db");
        Properties sync = new Properties();
        sync.setProperty("sync.shared.path", shared.toString());
        sync.setProperty("sync.local.path", local.toString());
        AppConfig config = config(sync);

        IngestionRun first = BatteryEtlApplication.runOnce(config, BatteryEtlApplication.parseRequest(args()));
        IngestionRun second = BatteryEtlApplication.runOnce(config, BatteryEtlApplication.parseRequest(args()));

        assertThat(first.getStatus()).isEqualTo(IngestionStatus.COMPLETED);
        assertThat(second.getStatus()).isEqualTo(IngestionStatus.DUPLICATE);
        assertThat(shared).exists();
        assertThat(new DbSyncManager(shared, local, Duration.ofMinutes(10)).isLocked()).isFalse();
    }

    @Test
    void runOnceFailsWhileSharedStoreIsLocked() throws IOException {
        Path shared = tempDir.resolve("share").resolve("battery.db");
        Path local = tempDir.resolve("local").resolve("battery.db");
        Properties sync = new Properties();
        sync.setProperty("sync.shared.path", shared.toString());
        sync.setProperty("sync.local.path", local.toString());
        AppConfig config = config(sync);

        Files.createDirectories(shared.getParent());
        DbSyncManager other = new DbSyncManager(shared, local, Duration.ofMinutes(10));
        other.acquireLock();
        try {
            IngestionRequest request = BatteryEtlApplication.parseRequest(args());
            assertThatThrownBy(() -> BatteryEtlApplication.runOnce(config, request))
                    .isInstanceOf(DatabaseLockedException.class);
        } finally {
            other.releaseLock();
        }
    }
}
