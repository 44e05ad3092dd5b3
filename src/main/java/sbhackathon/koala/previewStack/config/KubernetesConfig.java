package sbhackathon.koala.previewStack.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "k8s")
public class KubernetesConfig {

    private String fieldManager = "preview-stack";
    private Storage storage = new Storage();
    private Map<String, RegistryCredentials> registries = new LinkedHashMap<>();
    private BaseIngressRoute baseIngressRoute = new BaseIngressRoute();

    public String getFieldManager() {
        return fieldManager;
    }

    public void setFieldManager(String fieldManager) {
        this.fieldManager = fieldManager;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    /**
     * 레지스트리 호스트 -> 인증 정보. 비어 있으면 ImagePullSecret을 만들지 않습니다.
     */
    public Map<String, RegistryCredentials> getRegistries() {
        return registries;
    }

    public void setRegistries(Map<String, RegistryCredentials> registries) {
        this.registries = registries;
    }

    public BaseIngressRoute getBaseIngressRoute() {
        return baseIngressRoute;
    }

    public void setBaseIngressRoute(BaseIngressRoute baseIngressRoute) {
        this.baseIngressRoute = baseIngressRoute;
    }

    public static class Storage {
        private DataSize size = DataSize.ofGigabytes(2);
        private String storageClass = "local-path";

        public DataSize getSize() {
            return size;
        }

        public void setSize(DataSize size) {
            this.size = size;
        }

        public String getStorageClass() {
            return storageClass;
        }

        public void setStorageClass(String storageClass) {
            this.storageClass = storageClass;
        }
    }

    public static class RegistryCredentials {
        private String username;
        private String password;

        public RegistryCredentials() {
        }

        public RegistryCredentials(String username, String password) {
            this.username = username;
            this.password = password;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }
    }

    /**
     * 이 시스템의 API로 들어오는 IngressRoute. 설정되어 있으면 배포되는 서비스도 같은 규칙(호스트 등)을 사용합니다.
     */
    public static class BaseIngressRoute {
        private String namespace = "default";
        private String name;

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isConfigured() {
            return name != null && !name.isBlank();
        }
    }
}
