package org.smileyface.newscrawler.listing;

import org.smileyface.newscrawler.model.ArticleReference;

import java.util.List;

/**
 * One page of a source's daily listing.
 *
 * @param references  candidate articles in page order, without duplicates or excluded verticals
 * @param hasNextPage true when the paging controls offer a further page
 * @param available   false when the page could not be loaded or has no listing container
 */
public record ListingPage(List<ArticleReference> references, boolean hasNextPage, boolean available) {

    public ListingPage {
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static ListingPage unavailable() {
        return new ListingPage(List.of(), false, false);
    }

    public boolean isEmpty() {
        return references.isEmpty();
    }
}
