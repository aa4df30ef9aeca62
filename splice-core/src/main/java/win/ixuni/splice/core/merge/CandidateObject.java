package win.ixuni.splice.core.merge;

import lombok.Value;
import win.ixuni.splice.core.model.StoredObject;

/**
 * A listed object considered as merge input
 */
@Value
public class CandidateObject {

    String key;

    /**
     * Key with everything up to the last separator removed
     */
    String name;

    public static CandidateObject of(StoredObject object) {
        return new CandidateObject(object.getKey(), ObjectKeys.extractName(object.getKey()));
    }

    public boolean startsWith(String initialName) {
        return name.startsWith(initialName);
    }

    public boolean endsWith(String extension) {
        return name.endsWith(extension);
    }
}
