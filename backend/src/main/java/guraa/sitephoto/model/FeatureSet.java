package guraa.sitephoto.model;

import java.util.Collections;
import java.util.List;

/**
 * Keypoints and 256-bit binary descriptors extracted from one photo.
 * Descriptor {@code i} belongs to keypoint {@code i}. Instances are read-only and
 * may be shared between matching threads.
 */
public final class FeatureSet {

    /**
     * Number of 64-bit words in one descriptor.
     */
    public static final int DESCRIPTOR_WORDS = 4;

    private final String photoId;
    private final List<Keypoint> keypoints;
    private final long[][] descriptors;
    private final double scaleFactor;

    /**
     * @param photoId The photo the features were extracted from
     * @param keypoints The keypoints, strongest first
     * @param descriptors One packed descriptor per keypoint
     * @param scaleFactor Original longer side divided by processed longer side
     */
    public FeatureSet(String photoId, List<Keypoint> keypoints, long[][] descriptors, double scaleFactor) {
        if (keypoints.size() != descriptors.length) {
            throw new IllegalArgumentException("Keypoint count " + keypoints.size()
                    + " does not match descriptor count " + descriptors.length);
        }
        this.photoId = photoId;
        this.keypoints = Collections.unmodifiableList(List.copyOf(keypoints));
        this.descriptors = new long[descriptors.length][];
        for (int i = 0; i < descriptors.length; i++) {
            if (descriptors[i].length != DESCRIPTOR_WORDS) {
                throw new IllegalArgumentException("Descriptor " + i + " has " + descriptors[i].length + " words");
            }
            this.descriptors[i] = descriptors[i].clone();
        }
        this.scaleFactor = scaleFactor;
    }

    public static FeatureSet empty(String photoId) {
        return new FeatureSet(photoId, List.of(), new long[0][], 1.0);
    }

    public String getPhotoId() {
        return photoId;
    }

    public List<Keypoint> getKeypoints() {
        return keypoints;
    }

    public int size() {
        return descriptors.length;
    }

    public boolean isEmpty() {
        return descriptors.length == 0;
    }

    /**
     * @param index Descriptor index
     * @return The packed descriptor words; must not be modified
     */
    public long[] descriptor(int index) {
        return descriptors[index];
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    @Override
    public String toString() {
        return "FeatureSet[" + photoId + ", features=" + descriptors.length + ", scale=" + scaleFactor + "]";
    }
}
