package com.storefront.scraper.model;

import java.util.List;

/**
 * Everything extracted from one storefront in one run. Always fully
 * assembled: categories that yielded nothing are empty lists, never
 * {@code null}; only {@code brandText} may be absent.
 */
public record BrandInsights(List<Product> productCatalog,
                            List<Product> heroProducts,
                            List<Policy> policies,
                            List<Faq> faqs,
                            List<SocialHandle> socialHandles,
                            List<ContactDetail> contactDetails,
                            String brandText,
                            List<ImportantLink> importantLinks) {
}
