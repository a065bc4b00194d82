package mp3tags.v1;

import mp3tags.Tag;
import mp3tags.Version;
import mp3tags.frame.Comment;
import mp3tags.frame.Genres;

/**
 * Die festen Felder eines ID3v1-Tags.
 *
 * @param track Tracknummer aus ID3v1.1, oder {@code null}
 * @param genre Genre-Code, oder {@code null} für 255 (kein Genre)
 */
public record Id3v1Tag(
        String title,
        String artist,
        String album,
        String year,
        String comment,
        Integer track,
        Integer genre
) {
    /** @return Name des Genres, oder {@code null} */
    public String genreName() {
        return genre == null ? null : Genres.nameOf(genre);
    }

    /** Überträgt die Felder in ein ID3v2.4-Tag. Leere Felder werden weggelassen. */
    public Tag toTag() {
        Tag tag = new Tag(Version.ID3V24);
        if (!title.isEmpty()) tag.setTitle(title);
        if (!artist.isEmpty()) tag.setArtist(artist);
        if (!album.isEmpty()) tag.setAlbum(album);
        if (year.length() == 4 && year.chars().allMatch(Character::isDigit)) {
            tag.setYear(Integer.parseInt(year));
        }
        if (!comment.isEmpty()) tag.addComment(new Comment("eng", "", comment));
        if (track != null) tag.setTrack(track);
        String genreName = genreName();
        if (genreName != null) tag.setGenre(genreName);
        return tag;
    }

    @Override
    public String toString() {
        return String.format("""
                Titel: %s
                Künstler: %s
                Album: %s
                Jahr: %s
                Kommentar: %s
                Track: %s
                Genre: %s""",
                title, artist, album, year, comment,
                track == null ? "-" : track,
                genre == null ? "-" : genre + " (" + genreName() + ")");
    }
}
