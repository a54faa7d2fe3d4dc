package com.phillippitts.denoisebatch;

import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.service.engine.EngineRegistry;
import com.phillippitts.denoisebatch.service.media.MediaIoAdapter;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Tag("integration")
class DenoiseBatchApplicationTests {

    @Autowired
    private MediaIoAdapter mediaIoAdapter;

    @Autowired
    private EngineRegistry engineRegistry;

    @Test
    void contextLoads() {
        assertThat(mediaIoAdapter.name()).isEqualTo("wav");
        assertThat(engineRegistry.registeredKinds()).containsExactlyInAnyOrder(EngineKind.values());
    }
}
