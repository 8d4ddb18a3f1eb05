package co.fanki.cdnmirror.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects of the mirror model.
 *
 * <p>Value objects are immutable, compared by their attributes and
 * validated on construction. Package coordinates, peer contexts and
 * mirror filenames are value objects; index entries are not.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
