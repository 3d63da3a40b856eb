package app.learnbase.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "app.learnbase")
public record LearnbaseProps(
        Path notesDir,
        Path historyDir,
        String defaultSchedule
) {
}
