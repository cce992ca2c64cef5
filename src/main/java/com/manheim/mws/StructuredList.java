package com.manheim.mws;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A sequence parameter in the MWS {@code Label.N} convention, e.g. {@code MarketplaceId.Id.1}, {@code
 * MarketplaceId.Id.2}. The label is used verbatim and the index is 1-based.
 */
public final class StructuredList {
   private final String label;
   private final List<ParameterValue.Primitive> values;

   public StructuredList(String label, List<?> values) {
      if (label == null || label.isEmpty()) {
         throw InvalidQueryException.missingRequired("label");
      }
      List<ParameterValue.Primitive> rendered = new ArrayList<>(values.size());
      for (int i = 0; i < values.size(); i++) {
         rendered.add(ParameterValue.primitive(label + "." + (i + 1), values.get(i)));
      }
      this.label = label;
      this.values = Collections.unmodifiableList(rendered);
   }

   public static StructuredList of(String label, Object... values) {
      return new StructuredList(label, Arrays.asList(values));
   }

   public String getLabel() {
      return label;
   }

   public List<ParameterValue.Primitive> getValues() {
      return values;
   }

   @Override
   public String toString() {
      return label + values;
   }
}
