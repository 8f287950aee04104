package ai.policyatlas.projection;

import java.util.List;

/** A language's presentation template, keyed {@code namespace::presentationId}. */
public record PresentationDefinition(String id, List<PresentationElement> elements) {

    public PresentationDefinition {
        elements = List.copyOf(elements);
    }
}
