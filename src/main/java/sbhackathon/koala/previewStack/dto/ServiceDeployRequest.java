package sbhackathon.koala.previewStack.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 배포할 서비스 하나에 대한 요청.
 * <p>
 * {@code redeploy}는 {@code image-update}(기본값), {@code never}, {@code always} 중 하나이며,
 * {@code image-update}일 때는 {@code imageHash}가 있어야 합니다.
 */
public class ServiceDeployRequest {
    private String serviceName;
    private String image;
    private Integer port;
    private String containerType;
    private Map<String, String> env = new LinkedHashMap<>();
    private List<String> replicatedEnv = List.of();
    private Map<String, String> files = new LinkedHashMap<>();
    private String redeploy;
    private String imageHash;
    private List<String> volumes = List.of();

    public ServiceDeployRequest() {
    }

    public ServiceDeployRequest(String serviceName, String image) {
        this.serviceName = serviceName;
        this.image = image;
    }

    public String getServiceName() {
        return serviceName;
    }

    public void setServiceName(String serviceName) {
        this.serviceName = serviceName;
    }

    public String getImage() {
        return image;
    }

    public void setImage(String image) {
        this.image = image;
    }

    public Integer getPort() {
        return port;
    }

    public void setPort(Integer port) {
        this.port = port;
    }

    public String getContainerType() {
        return containerType;
    }

    public void setContainerType(String containerType) {
        this.containerType = containerType;
    }

    public Map<String, String> getEnv() {
        return env;
    }

    public void setEnv(Map<String, String> env) {
        this.env = env;
    }

    public List<String> getReplicatedEnv() {
        return replicatedEnv;
    }

    public void setReplicatedEnv(List<String> replicatedEnv) {
        this.replicatedEnv = replicatedEnv;
    }

    public Map<String, String> getFiles() {
        return files;
    }

    public void setFiles(Map<String, String> files) {
        this.files = files;
    }

    public String getRedeploy() {
        return redeploy;
    }

    public void setRedeploy(String redeploy) {
        this.redeploy = redeploy;
    }

    public String getImageHash() {
        return imageHash;
    }

    public void setImageHash(String imageHash) {
        this.imageHash = imageHash;
    }

    public List<String> getVolumes() {
        return volumes;
    }

    public void setVolumes(List<String> volumes) {
        this.volumes = volumes;
    }
}
