package ai.docsite.markdown.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a table-of-contents forest from the flat heading sequence of a tree.
 *
 * <p>A deeper heading opens one group per skipped level under the current cursor. A shallower heading
 * moves the cursor to the first entry, depth-first across the forest, whose level is one less than its
 * own; when there is none the cursor falls back to the last top-level entry. That fallback can attach a
 * heading under an earlier sibling section, which existing consumers rely on.
 */
public final class TableOfContentsGenerator {

    private TableOfContentsGenerator() {
    }

    public static List<TocEntry> generate(Node root) {
        return generate(AstTraversal.extractHeadings(root));
    }

    public static List<TocEntry> generate(List<HeadingInfo> headings) {
        List<Draft> toc = new ArrayList<>();
        int currentLevel = 0;
        Draft currentParent = null;

        for (HeadingInfo heading : headings) {
            int level = heading.level();
            if (level > currentLevel) {
                for (int i = currentLevel; i < level; i++) {
                    Draft group = new Draft(i + 1, null, null);
                    if (currentParent != null) {
                        currentParent.children.add(group);
                    } else {
                        toc.add(group);
                    }
                    currentParent = group;
                }
            } else if (level < currentLevel) {
                Draft parent = null;
                for (Draft entry : toc) {
                    parent = findParentAtLevel(entry, level);
                    if (parent != null) {
                        break;
                    }
                }
                currentParent = parent != null ? parent : toc.isEmpty() ? null : toc.get(toc.size() - 1);
            }

            if (currentParent != null) {
                currentParent.items.add(new Draft(level, heading.text(), heading.id()));
            }
            currentLevel = level;
        }

        List<TocEntry> entries = new ArrayList<>(toc.size());
        for (Draft draft : toc) {
            entries.add(draft.freeze());
        }
        return entries;
    }

    private static Draft findParentAtLevel(Draft entry, int level) {
        if (entry.level == level - 1) {
            return entry;
        }
        for (Draft child : entry.children) {
            Draft found = findParentAtLevel(child, level);
            if (found != null) {
                return found;
            }
        }
        for (Draft item : entry.items) {
            Draft found = findParentAtLevel(item, level);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static final class Draft {
        private final int level;
        private final String text;
        private final String id;
        private final List<Draft> items = new ArrayList<>();
        private final List<Draft> children = new ArrayList<>();

        private Draft(int level, String text, String id) {
            this.level = level;
            this.text = text;
            this.id = id;
        }

        private TocEntry freeze() {
            List<TocEntry> frozenItems = new ArrayList<>(items.size());
            for (Draft item : items) {
                frozenItems.add(item.freeze());
            }
            List<TocEntry> frozenChildren = new ArrayList<>(children.size());
            for (Draft child : children) {
                frozenChildren.add(child.freeze());
            }
            return new TocEntry(level, Optional.ofNullable(text), Optional.ofNullable(id), frozenItems, frozenChildren);
        }
    }
}
