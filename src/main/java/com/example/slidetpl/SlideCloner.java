package com.example.slidetpl;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.POIXMLDocumentPart;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.PackagingURIHelper;
import org.apache.poi.openxml4j.opc.TargetMode;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFRelation;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;

import java.net.URI;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 幻灯片复制：新幻灯片追加在末尾，内容与关系和源一致，
 * XML 里对关系 id 的引用改写为新幻灯片自己的 id。
 */
@Slf4j
final class SlideCloner {
    private SlideCloner() {}

    static XSLFSlide cloneSlide(XMLSlideShow ppt, XSLFSlide source) {
        XSLFSlide copy = ppt.createSlide(source.getSlideLayout());
        copy.getXmlObject().set(source.getXmlObject().copy());

        Map<String, String> idMap = new HashMap<>();
        String srcLayoutId = source.getRelationId(source.getSlideLayout());
        String dstLayoutId = copy.getRelationId(copy.getSlideLayout());
        if (srcLayoutId != null && dstLayoutId != null && !srcLayoutId.equals(dstLayoutId)) {
            idMap.put(srcLayoutId, dstLayoutId);
        }

        PackagePart srcPart = source.getPackagePart();
        PackagePart dstPart = copy.getPackagePart();
        try {
            for (PackageRelationship rel : srcPart.getRelationships()) {
                String type = rel.getRelationshipType();
                // 版式已由 createSlide 建好；备注页只属于一张幻灯片
                if (XSLFRelation.SLIDE_LAYOUT.getRelation().equals(type) || XSLFRelation.NOTES.getRelation().equals(type)) {
                    continue;
                }
                String newId = copyRelationship(source, copy, dstPart, rel);
                if (!rel.getId().equals(newId)) idMap.put(rel.getId(), newId);
            }
        } catch (InvalidFormatException e) {
            throw new InvalidTemplateException("cannot copy relationships of " + srcPart.getPartName(), e);
        }

        if (!idMap.isEmpty()) remapRelationIds(copy.getXmlObject(), idMap);
        log.debug("cloned {} -> {}, remapped ids {}", srcPart.getPartName(), dstPart.getPartName(), idMap);
        return copy;
    }

    private static String copyRelationship(XSLFSlide source, XSLFSlide copy, PackagePart dstPart, PackageRelationship rel)
            throws InvalidFormatException {
        String type = rel.getRelationshipType();
        if (rel.getTargetMode() == TargetMode.EXTERNAL) {
            return dstPart.addExternalRelationship(rel.getTargetURI().toString(), type).getId();
        }
        POIXMLDocumentPart target = source.getRelationById(rel.getId());
        XSLFRelation known = XSLFRelation.getInstance(type);
        if (target != null && known != null) {
            // 走 POI 的文档部件关系，引用计数由 POI 维护
            return copy.addRelation(null, known, target).getRelationship().getId();
        }
        URI targetUri = PackagingURIHelper.resolvePartUri(rel.getSourceURI(), rel.getTargetURI());
        return dstPart.addRelationship(PackagingURIHelper.createPartName(targetUri), TargetMode.INTERNAL, type).getId();
    }

    /**
     * 属性值等于表中旧 id 的一律换成新 id。一次遍历完成，替换结果不会再被匹配。
     */
    static void remapRelationIds(XmlObject xml, Map<String, String> idMap) {
        if (idMap.isEmpty()) return;
        Map<String, String> table = Collections.unmodifiableMap(new HashMap<>(idMap));
        try (XmlCursor c = xml.newCursor()) {
            int depth = 0;
            while (c.hasNextToken()) {
                XmlCursor.TokenType t = c.toNextToken();
                if (t.isStart()) {
                    depth++;
                } else if (t.isEnd()) {
                    if (depth-- == 0) break;
                } else if (t.isAttr()) {
                    String replacement = table.get(c.getTextValue());
                    if (replacement != null) c.setTextValue(replacement);
                }
            }
        }
    }
}
