package sbhackathon.koala.previewStack.config;

import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Clock;

@Configuration
@ConditionalOnProperty(prefix = "runtime", name = "type", havingValue = "KUBERNETES", matchIfMissing = true)
public class KubernetesClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(KubernetesClientConfig.class);

    @Bean
    public ApiClient kubernetesApiClient() {
        try {
            // kubeconfig 또는 in-cluster service account 순으로 찾습니다
            ApiClient client = Config.defaultClient();
            logger.info("Kubernetes API client 초기화 완료: {}", client.getBasePath());
            return client;
        } catch (IOException e) {
            String errorMessage = "Kubernetes Client 초기화 실패 (Kubeconfig를 찾을 수 없거나 권한 문제): " + e.getMessage();
            logger.error(errorMessage, e);
            throw new IllegalStateException(errorMessage, e);
        }
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
