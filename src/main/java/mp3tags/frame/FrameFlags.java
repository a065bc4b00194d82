package mp3tags.frame;

/**
 * Statusflags und Formatflags eines Frames. {@code unsynchronisation} und {@code dataLengthIndicator} gibt es
 * nur in v2.4, v2.2 kennt gar keine Flags.
 *
 * @param groupingIdentifier Gruppenkennung (0-255) oder {@code null}
 */
public record FrameFlags(
        boolean tagAlterPreservation,
        boolean fileAlterPreservation,
        boolean readOnly,
        Integer groupingIdentifier,
        boolean compression,
        boolean encryption,
        boolean unsynchronisation,
        boolean dataLengthIndicator
) {
    public static final FrameFlags NONE = new FrameFlags(false, false, false, null, false, false, false, false);

    public FrameFlags {
        if (groupingIdentifier != null && (groupingIdentifier < 0 || groupingIdentifier > 0xFF)) {
            throw new IllegalArgumentException("Gruppenkennung muss ein Byte sein: " + groupingIdentifier);
        }
    }

    public FrameFlags withCompression(boolean value) {
        return new FrameFlags(tagAlterPreservation, fileAlterPreservation, readOnly, groupingIdentifier,
                value, encryption, unsynchronisation, dataLengthIndicator);
    }

    public FrameFlags withUnsynchronisation(boolean value) {
        return new FrameFlags(tagAlterPreservation, fileAlterPreservation, readOnly, groupingIdentifier,
                compression, encryption, value, dataLengthIndicator);
    }

    public FrameFlags withDataLengthIndicator(boolean value) {
        return new FrameFlags(tagAlterPreservation, fileAlterPreservation, readOnly, groupingIdentifier,
                compression, encryption, unsynchronisation, value);
    }

    public FrameFlags withGroupingIdentifier(Integer value) {
        return new FrameFlags(tagAlterPreservation, fileAlterPreservation, readOnly, value,
                compression, encryption, unsynchronisation, dataLengthIndicator);
    }

    public FrameFlags withEncryption(boolean value) {
        return new FrameFlags(tagAlterPreservation, fileAlterPreservation, readOnly, groupingIdentifier,
                compression, value, unsynchronisation, dataLengthIndicator);
    }

    public FrameFlags withFileAlterPreservation(boolean value) {
        return new FrameFlags(tagAlterPreservation, value, readOnly, groupingIdentifier,
                compression, encryption, unsynchronisation, dataLengthIndicator);
    }
}
