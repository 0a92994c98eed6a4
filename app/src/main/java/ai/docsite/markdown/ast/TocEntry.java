package ai.docsite.markdown.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Table-of-contents node. A group entry only has a level and exists to hold deeper headings when
 * levels are skipped; a heading entry also has text and an anchor id.
 */
public record TocEntry(int level, Optional<String> text, Optional<String> id, List<TocEntry> items,
                       List<TocEntry> children) {

    public TocEntry {
        text = text == null ? Optional.empty() : text;
        id = id == null ? Optional.empty() : id;
        items = List.copyOf(Objects.requireNonNull(items, "items"));
        children = List.copyOf(Objects.requireNonNull(children, "children"));
    }

    public boolean isGroup() {
        return text.isEmpty();
    }
}
