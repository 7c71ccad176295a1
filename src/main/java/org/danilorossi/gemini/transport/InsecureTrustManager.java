package org.danilorossi.gemini.transport;

import java.security.cert.X509Certificate;
import javax.net.ssl.X509TrustManager;

/** Trust manager that accepts every certificate chain. Backs {@link TrustPolicy#ACCEPT_ANY}. */
class InsecureTrustManager implements X509TrustManager {

  @Override
  public void checkClientTrusted(final X509Certificate[] chain, final String authType) {}

  @Override
  public void checkServerTrusted(final X509Certificate[] chain, final String authType) {}

  @Override
  public X509Certificate[] getAcceptedIssuers() {
    return new X509Certificate[0];
  }
}
