package com.friendfeed;

import com.friendfeed.aggregate.scheduler.BoundedTaskScheduler;
import com.friendfeed.aggregate.service.AggregationRunService;
import com.friendfeed.aggregate.tracker.GitHubIssueClient;
import com.friendfeed.aggregate.tracker.TrackerClient;
import com.friendfeed.config.AggregatorProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class FriendFeedApplicationContextTest {
    @Autowired
    private AggregationRunService runService;

    @Autowired
    private BoundedTaskScheduler scheduler;

    @Autowired
    private TrackerClient trackerClient;

    @Autowired
    private AggregatorProperties properties;

    @Test
    void contextWiresThePipelineFromTestProfile() {
        assertThat(runService).isNotNull();
        assertThat(trackerClient).isInstanceOf(GitHubIssueClient.class);
        assertThat(scheduler.ceiling()).isEqualTo(2);
        assertThat(properties.getRetryDelayMs()).isEqualTo(1);
        assertThat(properties.isDryRun()).isTrue();
        assertThat(properties.getCli().isRun()).isFalse();
        assertThat(properties.getGithub().getRepository()).isEqualTo("example/friends");
        assertThat(properties.getDateFormat()).isEqualTo("YYYY-MM-DD HH:mm:ss");
    }
}
