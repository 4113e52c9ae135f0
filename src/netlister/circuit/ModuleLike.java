package netlister.circuit;

import java.util.List;

/**
 * Anything an {@link Instance} can refer to: a locally defined {@link Module} or an {@link ExternalModule}.
 */
public sealed interface ModuleLike permits Module, ExternalModule {
  String name();

  /** Declared port order, authoritative for every instantiation. */
  List<Port> ports();
}
