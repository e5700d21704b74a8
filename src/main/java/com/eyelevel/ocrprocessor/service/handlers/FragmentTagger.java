package com.eyelevel.ocrprocessor.service.handlers;

import com.eyelevel.ocrprocessor.model.FragmentSource;
import com.eyelevel.ocrprocessor.model.ImageReference;
import com.eyelevel.ocrprocessor.model.TextFragment;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Attaches source tags and page numbers to raw extraction output. Never throws: anything it cannot parse
 * falls back to an untagged (no page number) fragment.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class FragmentTagger {

    private static final String OCR_PREFIX = "Page ";
    private static final String OCR_SEPARATOR = " (OCR): ";

    private static final Pattern PAGE_IMAGE = Pattern.compile("^page_(.+)\\.png$");
    private static final Pattern SLIDE_IMAGE = Pattern.compile("^slide([^_]*)_img.*$");

    /**
     * Tags a PDF text fragment. {@code "Page N (OCR): body"} becomes {@code body} tagged {@code ocr} with page
     * {@code N}. Anything else, including a non-numeric {@code N}, stays as-is and is tagged {@code text}.
     */
    public static TextFragment tagPdfText(String text) {
        if (text != null && text.startsWith(OCR_PREFIX)) {
            final int separator = text.indexOf(OCR_SEPARATOR);
            if (separator > 0) {
                final Integer page = parsePageNumber(text.substring(OCR_PREFIX.length(), separator));
                if (page != null) {
                    return new TextFragment(text.substring(separator + OCR_SEPARATOR.length()), FragmentSource.OCR,
                                            page);
                }
            }
        }
        return new TextFragment(text, FragmentSource.TEXT, null);
    }

    /**
     * @return {@code true} if the file name follows the {@code page_<N>.png} convention of PDF page renders.
     */
    public static boolean isPageImage(String imageFileName) {
        return imageFileName.startsWith("page_") && imageFileName.endsWith(".png");
    }

    /**
     * @return {@code true} if the file name follows the {@code slide<S>_img<K>.<ext>} convention.
     */
    public static boolean isSlideImage(String imageFileName) {
        return imageFileName.startsWith("slide") && imageFileName.contains("_img");
    }

    public static ImageReference tagPageImage(String path, String imageFileName) {
        final Matcher matcher = PAGE_IMAGE.matcher(imageFileName);
        final Integer page = matcher.matches() ? parsePageNumber(matcher.group(1)) : null;
        return new ImageReference(path, FragmentSource.PAGE, page);
    }

    public static ImageReference tagSlideImage(String path, String imageFileName) {
        final Matcher matcher = SLIDE_IMAGE.matcher(imageFileName);
        final Integer slide = matcher.matches() ? parsePageNumber(matcher.group(1)) : null;
        return new ImageReference(path, FragmentSource.SLIDE, slide);
    }

    private static Integer parsePageNumber(String candidate) {
        try {
            return Integer.valueOf(candidate.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
