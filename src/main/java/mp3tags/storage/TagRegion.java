package mp3tags.storage;

import mp3tags.Version;

/**
 * Lage eines ID3v2-Tags in der Datei. Das Tag beginnt immer bei 0.
 *
 * @param end erstes Byte nach dem Tag, also Header + Größe (+ Footer)
 */
public record TagRegion(Version version, int flags, long end) {
}
