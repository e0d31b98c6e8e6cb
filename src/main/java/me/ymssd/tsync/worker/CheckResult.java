package me.ymssd.tsync.worker;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;
import me.ymssd.tsync.model.KeyRange;
import me.ymssd.tsync.model.KeyRangeToCheck;

/**
 * What comparing the hashes of one range told us to do next.
 *
 * @author denghui
 * @create 2018/10/11
 */
@Value
public class CheckResult {

    public enum Outcome {
        MATCHED, SUBDIVIDE, RETRIEVE
    }

    private Outcome outcome;
    private List<KeyRangeToCheck> children;
    private KeyRange rangeToRetrieve;

    private CheckResult(Outcome outcome, List<KeyRangeToCheck> children, KeyRange rangeToRetrieve) {
        this.outcome = outcome;
        this.children = children;
        this.rangeToRetrieve = rangeToRetrieve;
    }

    public static CheckResult matched() {
        return new CheckResult(Outcome.MATCHED, ImmutableList.of(), null);
    }

    public static CheckResult subdivide(List<KeyRangeToCheck> children) {
        Preconditions.checkArgument(children != null && !children.isEmpty(), "no child ranges");
        return new CheckResult(Outcome.SUBDIVIDE, ImmutableList.copyOf(children), null);
    }

    public static CheckResult retrieve(KeyRange range) {
        Preconditions.checkNotNull(range);
        return new CheckResult(Outcome.RETRIEVE, ImmutableList.of(), range);
    }
}
