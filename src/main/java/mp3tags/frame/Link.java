package mp3tags.frame;

import java.util.Objects;

public record Link(String url) implements Content {

    public Link {
        Objects.requireNonNull(url, "url");
    }

    @Override
    public ContentType type() {
        return ContentType.LINK;
    }
}
