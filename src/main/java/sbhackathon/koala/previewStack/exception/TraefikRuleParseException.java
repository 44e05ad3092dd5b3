package sbhackathon.koala.previewStack.exception;

/**
 * Traefik 라우팅 규칙 또는 저장된 IngressRoute를 내부 모델로 변환하지 못한 경우.
 * 클러스터의 오브젝트는 외부에서 수정될 수 있으므로 복구 가능한 오류로 다룹니다.
 */
public class TraefikRuleParseException extends Exception {

    public TraefikRuleParseException(String message) {
        super(message);
    }
}
