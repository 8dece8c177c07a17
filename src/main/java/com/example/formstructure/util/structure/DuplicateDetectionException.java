package com.example.formstructure.util.structure;

/**
 * 同一页中出现重复的 detection_id
 */
public class DuplicateDetectionException extends StructureValidationException {

    private final String detectionId;

    public DuplicateDetectionException(String detectionId) {
        super("重复的 detection_id: " + detectionId);
        this.detectionId = detectionId;
    }

    public String getDetectionId() {
        return detectionId;
    }
}
