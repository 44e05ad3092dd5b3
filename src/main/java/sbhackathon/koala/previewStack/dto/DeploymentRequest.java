package sbhackathon.koala.previewStack.dto;

import java.util.List;

public class DeploymentRequest {
    private String appName;
    private List<ServiceDeployRequest> services;

    public DeploymentRequest() {
    }

    public DeploymentRequest(String appName, List<ServiceDeployRequest> services) {
        this.appName = appName;
        this.services = services;
    }

    public String getAppName() {
        return appName;
    }

    public void setAppName(String appName) {
        this.appName = appName;
    }

    public List<ServiceDeployRequest> getServices() {
        return services;
    }

    public void setServices(List<ServiceDeployRequest> services) {
        this.services = services;
    }
}
