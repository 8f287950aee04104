package ai.policyatlas.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A category as declared in a definition file. Links to parent and children are held by the {@link IPolicyGraph}, not
 * here.
 *
 * @param parentRefRaw the {@code parentCategory ref} exactly as written, e.g. {@code windows:WindowsComponents}
 * @param parentRefUniqueId the reference after namespace resolution; equal to {@code parentRefRaw} if its prefix was
 *     unknown
 */
public record CategoryDefinition(
        String uniqueId,
        String name,
        String namespaceUri,
        @Nullable String displayNameToken,
        @Nullable String parentRefRaw,
        @Nullable String parentRefUniqueId,
        SourceFile source) {

    public boolean declaresParent() {
        return parentRefUniqueId != null;
    }

    @Override
    public String toString() {
        return "CATEGORY[" + uniqueId + "]";
    }
}
