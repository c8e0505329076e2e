/*
 * DavMail POP/IMAP/SMTP/CalDav/LDAP Exchange Gateway
 * Copyright (C) 2009  Mickael Guessant
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License
 * as published by the Free Software Foundation; either version 2
 * of the License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 51 Franklin Street, Fifth Floor, Boston, MA  02110-1301, USA.
 */
package davcal.multistatus;

import davcal.exception.MergeException;
import org.jdom.Document;
import org.jdom.Element;
import org.jdom.Namespace;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Merge per resource multistatus documents into one.
 */
public final class MultistatusMerger {

    private MultistatusMerger() {
    }

    /**
     * Merge documents, responses keep their order and content.
     * Namespace declarations are merged by prefix, first declaration wins.
     *
     * @param documents documents, null entries are skipped
     * @return merged document, the input itself when there is only one
     * @throws MergeException when there is no document to merge
     */
    public static Document merge(List<Document> documents) throws MergeException {
        List<Document> inputs = new ArrayList<>();
        if (documents != null) {
            for (Document document : documents) {
                if (document != null && document.hasRootElement()) {
                    inputs.add(document);
                }
            }
        }
        if (inputs.isEmpty()) {
            throw new MergeException("EXCEPTION_NO_DOCUMENTS_TO_MERGE");
        }
        if (inputs.size() == 1) {
            return inputs.get(0);
        }

        Element firstRoot = inputs.get(0).getRootElement();
        Element root = new Element(firstRoot.getName(), firstRoot.getNamespace());
        Map<String, String> declaredPrefixes = new HashMap<>();
        declaredPrefixes.put(root.getNamespacePrefix(), root.getNamespaceURI());

        for (Document document : inputs) {
            Element documentRoot = document.getRootElement();
            declare(root, declaredPrefixes, documentRoot.getNamespace());
            for (Object additional : documentRoot.getAdditionalNamespaces()) {
                declare(root, declaredPrefixes, (Namespace) additional);
            }
        }
        for (Document document : inputs) {
            for (Object child : document.getRootElement().getChildren()) {
                root.addContent((Element) ((Element) child).clone());
            }
        }
        return new Document(root);
    }

    private static void declare(Element root, Map<String, String> declaredPrefixes, Namespace namespace) {
        if (namespace.getPrefix().isEmpty() || declaredPrefixes.containsKey(namespace.getPrefix())) {
            return;
        }
        declaredPrefixes.put(namespace.getPrefix(), namespace.getURI());
        root.addNamespaceDeclaration(namespace);
    }
}
