package org.javai.runner.process;

import org.javai.runner.RunnerError;
import org.javai.runner.RunnerException;
import org.javai.runner.concurrent.RunContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessPoolTest {

    @TempDir
    Path dir;

    @Test
    void warmup_runsVersionProbe() throws Exception {
        Path binary = FakeBinary.script(dir, "claude",
                "if [ \"$1\" = \"--version\" ]; then echo \"1.0.27 (Claude Code)\"; else exit 9; fi");
        ProcessPool pool = new ProcessPool(binary.toString(), dir);

        String version = pool.warmup(RunContext.background());

        assertThat(version).isEqualTo("1.0.27 (Claude Code)");
        assertThat(pool.isWarm()).isTrue();
    }

    @Test
    void warmup_missingBinary_staysCold() {
        ProcessPool pool = new ProcessPool(dir.resolve("absent").toString(), dir);

        assertThatThrownBy(() -> pool.warmup(RunContext.background()))
                .isInstanceOfSatisfying(RunnerException.class,
                        e -> assertThat(e.error()).isEqualTo(RunnerError.CLAUDE_NOT_FOUND));
        assertThat(pool.isWarm()).isFalse();
    }

    @Test
    void warmup_hangingBinary_timesOut() throws Exception {
        Path binary = FakeBinary.script(dir, "claude", "sleep 30");
        ProcessPool pool = new ProcessPool(binary.toString(), dir, Duration.ofMillis(200));

        assertThatThrownBy(() -> pool.warmup(RunContext.background()))
                .isInstanceOfSatisfying(RunnerException.class,
                        e -> assertThat(e.error()).isEqualTo(RunnerError.TIMEOUT));
        assertThat(pool.isWarm()).isFalse();
    }
}
