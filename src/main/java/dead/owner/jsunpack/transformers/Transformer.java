package dead.owner.jsunpack.transformers;

import dead.owner.jsunpack.utils.rewrite.Replacement;
import dead.owner.jsunpack.utils.wrapper.ScriptSnapshot;

import java.util.List;

/**
 * Interface for all unpacking passes
 */
public interface Transformer {
    /**
     * Compute the edits of this pass. Never modifies the snapshot.
     *
     * @param snapshot The script to analyze
     * @return pairwise disjoint replacements valid against {@code snapshot}
     */
    List<Replacement> transform(ScriptSnapshot snapshot);
}
