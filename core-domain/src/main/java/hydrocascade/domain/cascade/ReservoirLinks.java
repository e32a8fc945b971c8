package hydrocascade.domain.cascade;

import java.util.List;

/**
 * Enlaces declarados de un embalse dentro de la cascada.
 *
 * @param upstream   Embalses inmediatamente aguas arriba.
 * @param downstream Embalses inmediatamente aguas abajo.
 */
public record ReservoirLinks(List<String> upstream, List<String> downstream) {

    public static final ReservoirLinks NONE = new ReservoirLinks(List.of(), List.of());

    public ReservoirLinks {
        upstream = upstream == null ? List.of() : List.copyOf(upstream);
        downstream = downstream == null ? List.of() : List.copyOf(downstream);
    }
}
