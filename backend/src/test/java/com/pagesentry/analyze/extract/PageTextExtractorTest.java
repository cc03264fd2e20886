package com.pagesentry.analyze.extract;

import com.pagesentry.analyze.model.ExtractedPage;
import com.pagesentry.config.AnalyzerProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PageTextExtractorTest {

    @Test
    void extractsVisibleTextWithoutChrome() {
        String html = """
            <html><head><style>.x{color:red}</style><script>var hidden = 'secret';</script></head>
            <body>
              <nav>Home | About</nav>
              <h1>Garden   supplies</h1>
              <p>Fresh
                 seeds and tools</p>
              <footer>copyright footer</footer>
            </body></html>
            """;

        ExtractedPage page = extractor(10).extract("https://shop.example.com/a", html);

        assertThat(page.text()).isEqualTo("Garden supplies Fresh seeds and tools");
        assertThat(page.text()).doesNotContain("secret", "Home", "copyright");
        assertThat(page.document().select("script")).hasSize(1);
    }

    @Test
    void resolvesAndCapsImageUrls() {
        String html = """
            <body>
              <img src="/img/a.png">
              <img data-src="b.jpg">
              <img src="//cdn.example.com/c.png">
              <img src="/img/a.png">
              <img src="data:image/png;base64,AAAA">
              <img src="https://other.example.com/d.png">
            </body>
            """;

        ExtractedPage page = extractor(3).extract("https://shop.example.com/dir/page", html);

        assertThat(page.imageUrls()).containsExactly(
            "https://shop.example.com/img/a.png",
            "https://shop.example.com/dir/b.jpg",
            "https://cdn.example.com/c.png"
        );
    }

    @Test
    void countsFrameworkMarkers() {
        String html = "<div id=\"root\"></div><script id=\"__NEXT_DATA__\">{}</script>";

        assertThat(PageTextExtractor.frameworkMarkers(html)).isEqualTo(2);
        assertThat(PageTextExtractor.frameworkMarkers("<p>plain</p>")).isZero();
    }

    private static PageTextExtractor extractor(int maxImages) {
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.getExtraction().setMaxImages(maxImages);
        return new PageTextExtractor(properties);
    }
}
