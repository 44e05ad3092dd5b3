package sbhackathon.koala.previewStack.infra.kubernetes.crd;

import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.openapi.models.V1ListMeta;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class IngressRouteList implements KubernetesListObject {

    private String apiVersion = IngressRoute.GROUP + "/" + IngressRoute.VERSION;
    private String kind = "IngressRouteList";
    private V1ListMeta metadata;
    private List<IngressRoute> items = new ArrayList<>();
}
