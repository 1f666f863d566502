package com.example.slidetpl;

import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.PackageRelationshipTypes;
import org.apache.poi.openxml4j.opc.PackagingURIHelper;
import org.apache.poi.sl.usermodel.PictureData;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.xmlbeans.XmlObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.example.slidetpl.TestDecks.para;
import static com.example.slidetpl.TestDecks.sld;
import static com.example.slidetpl.TestDecks.textBox;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SlideCloner")
class SlideClonerTest {

    // 1x1 透明 PNG
    private static final byte[] PNG = Base64.getDecoder().decode(
            "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAYAAAAfFcSJAAAADUlEQVR42mNkYPhfDwAChwGA60e6kgAAAABJRU5ErkJggg==");

    @Test
    @DisplayName("remap is a single pass, swapped ids do not chain")
    void remapSinglePass() throws Exception {
        XmlObject xml = XmlObject.Factory.parse("<root a=\"rId1\" c=\"other\"><child b=\"rId2\"/></root>");
        SlideCloner.remapRelationIds(xml, Map.of("rId1", "rId2", "rId2", "rId1"));
        String out = xml.xmlText();
        assertThat(out).contains("a=\"rId2\"").contains("b=\"rId1\"").contains("c=\"other\"");
    }

    @Test
    @DisplayName("clone is appended with the same layout and content")
    void appendsCopy() throws Exception {
        XMLSlideShow ppt = TestDecks.deck(textBox(para("Title {{ name }}")));
        XSLFSlide source = ppt.getSlides().get(0);

        XSLFSlide copy = SlideCloner.cloneSlide(ppt, source);

        assertThat(ppt.getSlides()).hasSize(2);
        assertThat(ppt.getSlides().get(1)).isSameAs(copy);
        assertThat(copy.getSlideLayout()).isSameAs(source.getSlideLayout());
        assertThat(TestDecks.text(copy)).isEqualTo("Title {{ name }}");
    }

    @Test
    @DisplayName("external hyperlink gets a fresh id and the copied XML points to it")
    void hyperlinkRemapped() throws Exception {
        XMLSlideShow ppt = new XMLSlideShow();
        XSLFSlide source = ppt.createSlide();
        source.getPackagePart().addExternalRelationship("https://example.com/", PackageRelationshipTypes.HYPERLINK_PART, "rId42");
        SlideXml.replace(source, sld(textBox(
                "<a:p><a:r><a:rPr lang=\"en-US\"><a:hlinkClick r:id=\"rId42\"/></a:rPr><a:t>link</a:t></a:r></a:p>")));

        XSLFSlide copy = SlideCloner.cloneSlide(ppt, source);

        String copyXml = SlideXml.serialize(copy);
        Matcher m = Pattern.compile("hlinkClick r:id=\"([^\"]+)\"").matcher(copyXml);
        assertThat(m.find()).isTrue();
        String newId = m.group(1);
        assertThat(newId).isNotEqualTo("rId42");
        PackageRelationship rel = copy.getPackagePart().getRelationship(newId);
        assertThat(rel).isNotNull();
        assertThat(rel.getTargetURI().toString()).isEqualTo("https://example.com/");
        assertThat(SlideXml.serialize(source)).contains("r:id=\"rId42\"");
    }

    @Test
    @DisplayName("picture reference resolves to the same media part")
    void pictureShared() throws Exception {
        XMLSlideShow ppt = new XMLSlideShow();
        XSLFSlide source = ppt.createSlide();
        XSLFPictureData picture = ppt.addPicture(PNG, PictureData.PictureType.PNG);
        source.createPicture(picture);

        XSLFSlide copy = SlideCloner.cloneSlide(ppt, source);

        Matcher m = Pattern.compile("r:embed=\"([^\"]+)\"").matcher(SlideXml.serialize(copy));
        assertThat(m.find()).isTrue();
        PackageRelationship rel = copy.getPackagePart().getRelationship(m.group(1));
        assertThat(rel).isNotNull();
        assertThat(PackagingURIHelper.resolvePartUri(copy.getPackagePart().getPartName().getURI(), rel.getTargetURI()))
                .isEqualTo(picture.getPackagePart().getPartName().getURI());

        XMLSlideShow reopened = TestDecks.reopen(ppt);
        assertThat(reopened.getSlides()).hasSize(2);
        assertThat(reopened.getPictureData()).hasSize(1);
    }

    @Test
    @DisplayName("notes stay with the source slide")
    void notesNotCopied() throws Exception {
        XMLSlideShow ppt = TestDecks.deck(textBox(para("body")));
        XSLFSlide source = ppt.getSlides().get(0);
        ppt.getNotesSlide(source);

        XSLFSlide copy = SlideCloner.cloneSlide(ppt, source);

        assertThat(source.getNotes()).isNotNull();
        assertThat(copy.getNotes()).isNull();
    }
}
