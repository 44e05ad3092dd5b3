package sbhackathon.koala.previewStack.service;

import sbhackathon.koala.previewStack.dto.DeploymentRequest;
import sbhackathon.koala.previewStack.entity.Service;
import sbhackathon.koala.previewStack.entity.ServiceConfig;

import java.util.List;

public interface PreviewDeploymentService {
    /**
     * 요청받은 서비스들을 하나의 애플리케이션으로 배포합니다.
     * 각 서비스는 {@code /{app}/{service}/} 경로로 라우팅됩니다.
     *
     * @param request 애플리케이션 이름과 배포할 서비스 목록을 담은 요청 객체
     * @return 배포된 서비스 목록
     */
    List<Service> deploy(DeploymentRequest request);

    /**
     * 애플리케이션의 모든 서비스를 중지합니다.
     */
    List<Service> stop(String appName);

    List<ServiceConfig> getConfigsOfApp(String appName);
}
