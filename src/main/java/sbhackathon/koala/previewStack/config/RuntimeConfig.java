package sbhackathon.koala.previewStack.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "runtime")
public class RuntimeConfig {

    private RuntimeType type = RuntimeType.KUBERNETES;
    private Annotations annotations = new Annotations();

    public RuntimeType getType() {
        return type;
    }

    public void setType(RuntimeType type) {
        this.type = type;
    }

    public Annotations getAnnotations() {
        return annotations;
    }

    public void setAnnotations(Annotations annotations) {
        this.annotations = annotations;
    }

    /**
     * 네임스페이스에 붙일 annotation. Docker 런타임에서는 의미가 없으므로 항상 비어 있습니다.
     */
    public Map<String, String> namespaceAnnotations() {
        if (type != RuntimeType.KUBERNETES) {
            return Map.of();
        }
        return annotations.getNamespace();
    }

    public enum RuntimeType {
        DOCKER,
        KUBERNETES
    }

    public static class Annotations {
        private Map<String, String> namespace = new LinkedHashMap<>();

        public Map<String, String> getNamespace() {
            return namespace;
        }

        public void setNamespace(Map<String, String> namespace) {
            this.namespace = namespace;
        }
    }
}
