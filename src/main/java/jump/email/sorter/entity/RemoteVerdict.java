package jump.email.sorter.entity;

import lombok.Value;

/**
 * What the remote classifier said about one message, already checked against the
 * configured category set.
 */
@Value
public class RemoteVerdict {
    String category;
    double confidence;
    String explanation;

    public static RemoteVerdict rejected(String declaredCategory) {
        return new RemoteVerdict(Category.UNKNOWN, 0.0,
            "Remote classifier returned invalid category '" + declaredCategory + "'");
    }

    public boolean isRejected() {
        return Category.UNKNOWN.equals(category);
    }
}
