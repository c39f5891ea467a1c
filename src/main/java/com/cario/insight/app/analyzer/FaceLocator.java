package com.cario.insight.app.analyzer;

import com.cario.insight.app.model.FaceBox;
import java.util.List;

/** Detection capability behind {@link FaceDetector}. Returns boxes in detector scan order. */
public interface FaceLocator {

  List<FaceBox> locate(DecodedImage image);

  String name();
}
