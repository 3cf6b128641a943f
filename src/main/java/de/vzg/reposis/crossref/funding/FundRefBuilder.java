package de.vzg.reposis.crossref.funding;

import java.util.Optional;

import org.jdom2.Element;
import org.springframework.stereotype.Service;

import de.vzg.reposis.crossref.markup.CrossrefNamespaces;
import de.vzg.reposis.crossref.model.Article;
import de.vzg.reposis.crossref.model.FundingAward;

/**
 * {@code fr:program name="fundref"} with one fundgroup assertion per award.
 */
@Service
public class FundRefBuilder implements FundingBuilder {

    @Override
    public Optional<Element> funding(Article article) {
        if (article.getFundingAwards().isEmpty()) {
            return Optional.empty();
        }
        Element program = new Element("program", CrossrefNamespaces.FUNDREF).setAttribute("name", "fundref");
        for (FundingAward award : article.getFundingAwards()) {
            Element fundGroup = assertion("fundgroup");
            if (isPresent(award.institutionName())) {
                Element funderName = assertion("funder_name").setText(award.institutionName());
                if (isPresent(award.institutionId())) {
                    funderName.addContent(assertion("funder_identifier").setText(award.institutionId()));
                }
                fundGroup.addContent(funderName);
            }
            for (String awardId : award.awardIds()) {
                fundGroup.addContent(assertion("award_number").setText(awardId));
            }
            program.addContent(fundGroup);
        }
        return Optional.of(program);
    }

    private static Element assertion(String name) {
        return new Element("assertion", CrossrefNamespaces.FUNDREF).setAttribute("name", name);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
