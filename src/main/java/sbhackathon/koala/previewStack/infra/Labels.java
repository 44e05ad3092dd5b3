package sbhackathon.koala.previewStack.infra;

/**
 * 생성하는 모든 오브젝트와 selector에 공통으로 쓰는 라벨/annotation 키.
 */
public final class Labels {

    private static final String PREFIX = "com.koala.preview.";

    public static final String APP_NAME = PREFIX + "app-name";
    public static final String SERVICE_NAME = PREFIX + "service-name";
    public static final String CONTAINER_TYPE = PREFIX + "container-type";
    public static final String IMAGE = PREFIX + "image";
    public static final String REPLICATED_ENV = PREFIX + "replicated-env";
    public static final String STORAGE_TYPE = PREFIX + "storage-type";

    private Labels() {
    }
}
