package sbhackathon.koala.previewStack.exception;

/**
 * 오케스트레이션 백엔드 호출 실패 (네트워크 오류, 충돌, 리소스 없음 등).
 * 호출 측에서 재시도하거나 사용자에게 그대로 전달할 수 있습니다.
 */
public class InfrastructureException extends RuntimeException {

    private final int statusCode;

    public InfrastructureException(String message) {
        this(message, 0, null);
    }

    public InfrastructureException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public InfrastructureException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * Kubernetes API 응답 코드. HTTP 응답을 받지 못한 경우 0.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
