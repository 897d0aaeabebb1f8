package com.promptguard.content.detect;

/** Which rendition of the input a threat was found in. */
public enum ContentVariant {
    ORIGINAL,
    BASE64_DECODED,
    URL_DECODED
}
