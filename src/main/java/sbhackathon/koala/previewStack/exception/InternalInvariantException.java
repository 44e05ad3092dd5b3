package sbhackathon.koala.previewStack.exception;

/**
 * 이 시스템이 직접 만든 입력이 불변 조건을 어긴 경우 (예: route가 하나도 없는 IngressRoute).
 * 일반적인 백엔드 실패가 아니라 프로그램 버그를 의미합니다.
 */
public class InternalInvariantException extends RuntimeException {

    public InternalInvariantException(String message) {
        super(message);
    }

    public InternalInvariantException(String message, Throwable cause) {
        super(message, cause);
    }
}
