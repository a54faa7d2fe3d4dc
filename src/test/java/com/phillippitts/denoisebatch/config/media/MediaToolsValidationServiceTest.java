package com.phillippitts.denoisebatch.config.media;

import com.phillippitts.denoisebatch.config.properties.MediaProperties;
import com.phillippitts.denoisebatch.exception.MediaException;
import com.phillippitts.denoisebatch.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.denoisebatch.testutil.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.denoisebatch.testutil.ProcessTestDoubles.TestProcess;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MediaToolsValidationServiceTest {

    @Test
    void shouldPassWhenBothToolsRun() {
        StubProcessFactory factory = new StubProcessFactory(
                cmd -> new TestProcess(ProcessBehavior.success(cmd.get(0) + " version 6.1")));
        MediaToolsValidationService service = new MediaToolsValidationService(MediaProperties.defaults(), factory);

        assertThatCode(service::validateOnStartup).doesNotThrowAnyException();
        assertThat(factory.commands()).containsExactly(
                List.of("ffmpeg", "-version"),
                List.of("ffprobe", "-version"));
    }

    @Test
    void shouldFailFastWhenToolExitsNonZero() {
        StubProcessFactory factory = new StubProcessFactory(
                new TestProcess(ProcessBehavior.failure(127, "command not found")));
        MediaToolsValidationService service = new MediaToolsValidationService(MediaProperties.defaults(), factory);

        assertThatThrownBy(service::validateOnStartup)
                .isInstanceOf(MediaException.class)
                .hasMessageContaining("exitCode=127")
                .hasMessageContaining("command not found");
    }

    @Test
    void wavBackendShouldSkipValidation() {
        StubProcessFactory factory = new StubProcessFactory(
                new TestProcess(ProcessBehavior.failure(1, "unused")));
        MediaProperties wav = new MediaProperties("wav", "ffmpeg", "ffprobe", 30, 600, 1000, 65536);

        new MediaToolsValidationService(wav, factory).validateOnStartup();

        assertThat(factory.commands()).isEmpty();
    }
}
