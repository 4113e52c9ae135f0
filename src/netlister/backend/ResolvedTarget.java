package netlister.backend;

import netlister.circuit.ModuleLike;

/**
 * Result of resolving an instance's module reference: the definition (for its port order) and the name to instantiate it by.
 */
public record ResolvedTarget(ModuleLike module, String moduleName) {}
