package com.shapecraft.generator.codegen.dedup;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.exception.IdentityCollisionException;
import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.codegen.shape.AnalyzedCallSite;
import com.shapecraft.generator.codegen.util.NamingUtil;

/**
 * Interns the structures of all call sites: one generated type per content
 * hash, whatever file or source type the structure came from.
 *
 * Call sites must be registered in declaration order; names are assigned by
 * {@link #seal()} and depend only on the set of registered structures, so the
 * output does not depend on the order in which call sites were analysed.
 */
public class StructureRegistry {
    private static final Logger log = LoggerFactory.getLogger(StructureRegistry.class);

    private final GeneratorConfig config;
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();

    private final Map<String, Structure> byHash = new LinkedHashMap<>();
    private final Map<String, String> signatures = new HashMap<>();
    private final Map<String, TreeSet<String>> hints = new HashMap<>();
    private final Map<String, String> packages = new HashMap<>();
    private final Map<String, Integer> occurrences = new HashMap<>();
    /** Declared DTO names per hash, with the package each was declared in. */
    private final Map<String, TreeMap<String, String>> explicitNames = new HashMap<>();
    /** Hash each declared qualified DTO name stands for. */
    private final Map<String, String> explicitOwners = new HashMap<>();

    private Map<String, GeneratedType> types;

    public StructureRegistry(GeneratorConfig config) {
        this.config = config;
    }

    /**
     * Registers the structures of an analysed call site.
     *
     * @return false when the site is dropped because its declared DTO name is
     *         already taken by a different structure
     * @throws IdentityCollisionException when a hash is reused by a different structure
     */
    public boolean register(AnalyzedCallSite site) {
        if (types != null) {
            throw new IllegalStateException("Registry is sealed");
        }
        if (site.isFailed()) {
            return false;
        }
        for (Structure structure : site.getStructures()) {
            checkCollision(structure);
        }

        CallSite callSite = site.getCallSite();
        Structure root = site.getRoot();
        String explicitName = site.getVariant().explicitRootName(callSite);
        if (explicitName != null && !root.isNamedTarget()) {
            String qualified = callSite.getPackageName() + "." + explicitName;
            String owner = explicitOwners.get(qualified);
            if (owner != null && !owner.equals(root.getContentHash())) {
                diagnostics.error(DiagnosticCode.NAME_CONFLICT, callSite.location(),
                        "DTO " + qualified + " is already declared with a different shape (hash " + owner + ")");
                log.warn("Dropping call site {}: DTO name {} already used by hash {}", callSite.location(),
                        qualified, owner);
                return false;
            }
            explicitOwners.put(qualified, root.getContentHash());
            explicitNames.computeIfAbsent(root.getContentHash(), h -> new TreeMap<>())
                    .put(explicitName, callSite.getPackageName());
        }

        for (Structure structure : site.getStructures()) {
            if (structure.isNamedTarget()) {
                continue;
            }
            String hash = structure.getContentHash();
            byHash.putIfAbsent(hash, structure);
            packages.putIfAbsent(hash, callSite.getPackageName());
            hints.computeIfAbsent(hash, h -> new TreeSet<>()).add(NamingUtil.toPascalCase(structure.getHintName()));
            occurrences.merge(hash, 1, Integer::sum);
        }
        return true;
    }

    private void checkCollision(Structure structure) {
        String existing = signatures.putIfAbsent(structure.getContentHash(), structure.getSignature());
        if (existing != null && !existing.equals(structure.getSignature())) {
            throw new IdentityCollisionException(structure.getContentHash(), existing, structure.getSignature());
        }
    }

    /**
     * Assigns a name to every registered hash. No registration is accepted afterwards.
     */
    public void seal() {
        if (types != null) {
            return;
        }
        Map<String, GeneratedType> named = new LinkedHashMap<>();
        Set<String> usedNames = new HashSet<>();
        explicitOwners.keySet().forEach(usedNames::add);

        for (Map.Entry<String, Structure> entry : byHash.entrySet()) {
            String hash = entry.getKey();
            TreeMap<String, String> declared = explicitNames.get(hash);
            GeneratedType type;
            if (declared != null) {
                Map.Entry<String, String> first = declared.firstEntry();
                List<String> aliases = new ArrayList<>(declared.keySet()).subList(1, declared.size());
                type = new GeneratedType(first.getValue(), first.getKey(), entry.getValue(), true,
                        List.copyOf(aliases));
                declared.keySet().stream().skip(1).forEach(other -> diagnostics.warning(DiagnosticCode.NAME_CONFLICT,
                        other, "DTO " + other + " has the same shape as " + first.getKey() + " and is generated as it"));
            } else {
                String hint = hints.get(hash).first();
                String packageName = packages.get(hash);
                String simpleName;
                if (config.isNestedDtoHashPackage()) {
                    packageName = packageName + ".shape_" + hash.toLowerCase(Locale.ROOT);
                    simpleName = hint + "Dto";
                } else {
                    simpleName = hint + "Dto_" + hash;
                }
                String qualified = NamingUtil.disambiguate(packageName + "." + simpleName, usedNames);
                simpleName = qualified.substring(packageName.length() + 1);
                type = new GeneratedType(packageName, simpleName, entry.getValue(), false, List.of());
            }
            usedNames.add(type.qualifiedName());
            named.put(hash, type);

            if (occurrences.getOrDefault(hash, 0) > 1) {
                log.info("DEDUPED STRUCTURE: {} share hash {} -> using shared type {}",
                        String.join(" and ", hints.get(hash)), hash, type.qualifiedName());
            }
        }
        types = named;
        log.debug("Registry sealed with {} generated type(s)", types.size());
    }

    public GeneratedType typeFor(String contentHash) {
        return findType(contentHash).orElseThrow(() -> new IllegalStateException(
                "No generated type for hash " + contentHash));
    }

    public Optional<GeneratedType> findType(String contentHash) {
        if (types == null) {
            throw new IllegalStateException("Registry is not sealed");
        }
        return Optional.ofNullable(types.get(contentHash));
    }

    /**
     * Generated types in first-registration order.
     */
    public List<GeneratedType> generatedTypes() {
        if (types == null) {
            throw new IllegalStateException("Registry is not sealed");
        }
        return new ArrayList<>(types.values());
    }

    public ToolDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
