package sbhackathon.koala.previewStack.infra.kubernetes.crd;

import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.openapi.models.V1ListMeta;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class MiddlewareList implements KubernetesListObject {

    private String apiVersion = IngressRoute.GROUP + "/" + IngressRoute.VERSION;
    private String kind = "MiddlewareList";
    private V1ListMeta metadata;
    private List<Middleware> items = new ArrayList<>();
}
