package com.mimecast.warden.transform;

/**
 * Transformation switches requested for one proxied document.
 */
public final class TransformOptions {

    private final boolean text;
    private final boolean withoutLinks;
    private final boolean bleach;
    private final boolean images;

    public TransformOptions(boolean text, boolean withoutLinks, boolean bleach, boolean images) {
        this.text = text;
        this.withoutLinks = withoutLinks;
        this.bleach = bleach;
        this.images = images;
    }

    /**
     * Converts HTML to plain text.
     *
     * @return Boolean.
     */
    public boolean isText() {
        return text;
    }

    /**
     * Drops link targets when converting to text.
     *
     * @return Boolean.
     */
    public boolean isWithoutLinks() {
        return withoutLinks;
    }

    public boolean isBleach() {
        return bleach;
    }

    public boolean isImages() {
        return images;
    }
}
