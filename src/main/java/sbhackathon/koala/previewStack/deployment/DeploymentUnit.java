package sbhackathon.koala.previewStack.deployment;

import lombok.Getter;
import lombok.ToString;
import sbhackathon.koala.previewStack.entity.AppName;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 하나의 애플리케이션으로 함께 배포되는 서비스 목록.
 */
@Getter
@ToString
public class DeploymentUnit {

    private final AppName appName;
    private final List<DeployableService> services;

    public DeploymentUnit(AppName appName, List<DeployableService> services) {
        Set<String> names = new HashSet<>();
        for (DeployableService service : services) {
            if (!names.add(service.getServiceName())) {
                throw new IllegalArgumentException(
                        "Duplicate service '" + service.getServiceName() + "' in app " + appName);
            }
        }
        this.appName = appName;
        this.services = List.copyOf(services);
    }
}
