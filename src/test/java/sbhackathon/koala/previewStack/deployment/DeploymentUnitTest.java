package sbhackathon.koala.previewStack.deployment;

import org.junit.jupiter.api.Test;
import sbhackathon.koala.previewStack.entity.AppName;
import sbhackathon.koala.previewStack.entity.ServiceConfig;
import sbhackathon.koala.previewStack.infra.traefik.TraefikIngressRoute;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentUnitTest {

    private static DeployableService service(String name) {
        return new DeployableService(
                ServiceConfig.builder().serviceName(name).image("nginx").build(),
                DeploymentStrategy.redeployNever(),
                TraefikIngressRoute.withDefaults(AppName.MASTER, name),
                List.of());
    }

    @Test
    void 서비스_순서를_유지() {
        DeploymentUnit unit = new DeploymentUnit(AppName.MASTER, List.of(service("web"), service("db")));

        assertThat(unit.getServices()).extracting(DeployableService::getServiceName)
                .containsExactly("web", "db");
    }

    @Test
    void 같은_이름의_서비스가_있으면_예외() {
        assertThatThrownBy(() -> new DeploymentUnit(AppName.MASTER, List.of(service("db"), service("db"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("db");
    }
}
