package sbhackathon.koala.previewStack.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.util.Optional;

/**
 * 모든 컨테이너에 공통으로 적용되는 기본값.
 */
@Configuration
@ConfigurationProperties(prefix = "container")
public class ContainerConfig {

    private DataSize memoryLimit;

    public ContainerConfig() {
    }

    public ContainerConfig(DataSize memoryLimit) {
        this.memoryLimit = memoryLimit;
    }

    public DataSize getMemoryLimit() {
        return memoryLimit;
    }

    public void setMemoryLimit(DataSize memoryLimit) {
        this.memoryLimit = memoryLimit;
    }

    public Optional<DataSize> memoryLimit() {
        return Optional.ofNullable(memoryLimit);
    }
}
