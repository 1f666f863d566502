package com.example.slidetpl;

import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlOptions;
import org.openxmlformats.schemas.presentationml.x2006.main.CTSlide;
import org.openxmlformats.schemas.presentationml.x2006.main.SldDocument;

import javax.xml.namespace.QName;
import java.util.HashMap;
import java.util.Map;

/** 幻灯片 XML 的字符串往返：序列化出 &lt;p:sld&gt; 整段，再整段写回 */
final class SlideXml {
    private SlideXml() {}

    static final String NS_A = "http://schemas.openxmlformats.org/drawingml/2006/main";
    static final String NS_P = "http://schemas.openxmlformats.org/presentationml/2006/main";
    static final String NS_R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";

    private static final Map<String, String> PREFIXES = new HashMap<>();
    static {
        PREFIXES.put(NS_A, "a");
        PREFIXES.put(NS_P, "p");
        PREFIXES.put(NS_R, "r");
    }

    /** 前缀固定为 a / p / r，后续的正则都按这几个前缀写；CTSlide 本身没有外层元素，补一个 p:sld */
    static String serialize(XSLFSlide slide) {
        XmlOptions options = new XmlOptions()
                .setSaveSyntheticDocumentElement(new QName(NS_P, "sld"))
                .setSaveSuggestedPrefixes(PREFIXES)
                .setSaveAggressiveNamespaces();
        return slide.getXmlObject().xmlText(options);
    }

    static void replace(XSLFSlide slide, String xml) throws XmlException {
        CTSlide parsed = SldDocument.Factory.parse(xml).getSld();
        slide.getXmlObject().set(parsed);
    }
}
