package com.opsagent.tracker;

import com.opsagent.tracker.config.ScanSettings;
import com.opsagent.tracker.service.WorkItemService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "tracker.api.base-url=http://localhost:9",
        "tracker.workspace.default-key=ws_test",
        "tracker.scan.max-pages=4"
})
class TrackerAgentApplicationTests {

    @Autowired
    private WorkItemService workItemService;

    @Autowired
    private ScanSettings scanSettings;

    @Test
    void contextLoads() {
        assertThat(workItemService).isNotNull();
        assertThat(scanSettings.maxPages()).isEqualTo(4);
    }
}
