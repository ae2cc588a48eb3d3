package dev;

import com.sun.net.httpserver.*;
import javax.net.ssl.*;

import java.io.*;
import java.math.BigInteger;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Executors;
import java.util.zip.GZIPOutputStream;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

/**
 * 로컬 점검용 사이트.
 * robots.txt → 사이트맵 인덱스 → (평문 + gzip) 사이트맵 → 페이지 순으로 연결되고,
 * 페이지마다 정상/404/리다이렉트/500/루프/지연/TLS 실패 링크가 섞여 있다.
 *
 * 사용: java dev.SmokeTarget [httpPort] [httpsPort]
 *   linkchex --url http://localhost:8080 --format html --output smoke.html
 */
public class SmokeTarget {

  static void add(HttpServer s, String path, HttpHandler h) { s.createContext(path, h); }

  public static void main(String[] args) throws Exception {
    int httpPort  = args.length > 0 ? Integer.parseInt(args[0]) : 8080;
    int httpsPort = args.length > 1 ? Integer.parseInt(args[1]) : 8443;

    // --- HTTP
    HttpServer http = HttpServer.create(new InetSocketAddress(httpPort), 0);
    wireEndpoints(http, "http://localhost:" + httpPort, "https://localhost:" + httpsPort);
    http.setExecutor(Executors.newFixedThreadPool(16));
    http.start();
    System.out.println("[linkchex-smoke] HTTP  server on  http://localhost:" + httpPort);

    // --- HTTPS (자가서명 → 검증 클라이언트에서는 TLS 실패로 보인다)
    try {
      HttpsServer https = HttpsServer.create(new InetSocketAddress(httpsPort), 0);
      SSLContext ssl = selfSignedContext("localhost");
      https.setHttpsConfigurator(new HttpsConfigurator(ssl));
      wireEndpoints(https, "https://localhost:" + httpsPort, "https://localhost:" + httpsPort);
      https.setExecutor(Executors.newFixedThreadPool(4));
      https.start();
      System.out.println("[linkchex-smoke] HTTPS server on https://localhost:" + httpsPort + " (self-signed)");
    } catch (Exception e) {
      System.out.println("[linkchex-smoke] HTTPS disabled (" + e.getClass().getSimpleName() + ": " + e.getMessage() + ")");
    }
  }

  static void wireEndpoints(HttpServer s, String base, String tlsBase) {
    add(s, "/robots.txt", ex -> resp(ex, 200, "text/plain",
        "User-agent: *\nAllow: /\n\nSitemap: " + base + "/sitemap_index.xml\n"));

    add(s, "/sitemap_index.xml", ex -> resp(ex, 200, "application/xml",
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" +
        "<sitemapindex xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">\n" +
        "  <sitemap><loc>" + base + "/sitemap-pages.xml</loc></sitemap>\n" +
        "  <sitemap><loc>/sitemap-blog.xml.gz</loc></sitemap>\n" +
        "  <sitemap><loc>" + base + "/sitemap-missing.xml</loc></sitemap>\n" +
        "</sitemapindex>\n"));

    add(s, "/sitemap-pages.xml", ex -> resp(ex, 200, "application/xml",
        urlset(base + "/", base + "/about", base + "/assets", base + "/server-error")));

    // gzip 사이트맵: Content-Encoding 없이 gzip 바이트 그대로
    add(s, "/sitemap-blog.xml.gz", ex -> {
      ByteArrayOutputStream buf = new ByteArrayOutputStream();
      try (GZIPOutputStream gz = new GZIPOutputStream(buf)) {
        gz.write(urlset(base + "/blog/1", base + "/blog/2").getBytes(StandardCharsets.UTF_8));
      }
      respBytes(ex, 200, "application/gzip", buf.toByteArray());
    });

    // --- 페이지
    add(s, "/", ex -> {
      if (!"/".equals(ex.getRequestURI().getPath())) { resp(ex, 404, "text/html", "<h1>Not Found</h1>"); return; }
      resp(ex, 200, "text/html", page("Home",
          "<li><a href=\"/about\">About</a></li>" +
          "<li><a href=\"/ok\">OK target</a></li>" +
          "<li><a href=\"/missing\">Missing (404)</a></li>" +
          "<li><a href=\"/moved\">Moved (301)</a></li>" +
          "<li><a href=\"/error\">Error (500)</a></li>" +
          "<li><a href=\"/loop\">Redirect loop</a></li>" +
          "<li><a href=\"/slow\">Slow (3s)</a></li>" +
          "<li><a href=\"/get-only\">GET only (405 on HEAD)</a></li>" +
          "<li><a href=\"" + tlsBase + "/ok\">Self-signed TLS</a></li>" +
          "<li><a href=\"https://example.com/\">External</a></li>" +
          "<li><a href=\"mailto:team@example.com\">Mail</a></li>" +
          "<li><a href=\"javascript:void(0)\">Script link</a></li>" +
          "<li><a href=\"#top\">Top</a></li>"));
    });

    add(s, "/about", ex -> resp(ex, 200, "text/html", page("About",
        "<li><a href=\"/\">Home</a></li>" +
        "<li><a href=\"/ok\">OK target</a></li>" +
        "<li><a href=\"/missing\">Missing again (cache hit)</a></li>")));

    add(s, "/assets", ex -> resp(ex, 200, "text/html",
        "<html><head><title>Assets</title>" +
        "<link rel=\"stylesheet\" href=\"/style.css\">" +
        "<script src=\"/app.js\"></script>" +
        "<script src=\"/missing.js\"></script>" +
        "</head><body>" +
        "<img src=\"/logo.png\" alt=\"logo\">" +
        "<img src=\"/missing.png\" alt=\"gone\">" +
        "<a href=\"/ok?utm_source=smoke\">tracked</a>" +
        "</body></html>"));

    add(s, "/blog/", ex -> resp(ex, 200, "text/html", page("Blog " + ex.getRequestURI().getPath(),
        "<li><a href=\"/\">Home</a></li>" +
        "<li><a href=\"/moved\">Old permalink</a></li>")));

    // --- 링크 대상
    add(s, "/ok", ex -> resp(ex, 200, "text/plain", "ok"));
    add(s, "/style.css", ex -> resp(ex, 200, "text/css", "body{font-family:sans-serif}"));
    add(s, "/app.js", ex -> resp(ex, 200, "application/javascript", "console.log('ok');"));
    add(s, "/logo.png", ex -> respBytes(ex, 200, "image/png", new byte[]{(byte) 0x89, 'P', 'N', 'G'}));
    add(s, "/missing", ex -> resp(ex, 404, "text/html", "<h1>Not Found</h1>"));
    add(s, "/error", ex -> resp(ex, 500, "text/plain", "boom"));
    add(s, "/server-error", ex -> resp(ex, 503, "text/plain", "page unavailable"));
    add(s, "/moved", ex -> redirect(ex, 301, "/ok"));
    add(s, "/loop", ex -> redirect(ex, 302, "/loop"));

    add(s, "/slow", ex -> {
      try {
        Thread.sleep(3_000);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
      resp(ex, 200, "text/plain", "finally");
    });

    add(s, "/get-only", ex -> {
      if ("HEAD".equalsIgnoreCase(ex.getRequestMethod())) {
        ex.getResponseHeaders().set("Allow", "GET");
        ex.sendResponseHeaders(405, -1);
        ex.close();
        return;
      }
      resp(ex, 200, "text/plain", "get works");
    });
  }

  // ===== HTTPS: 실행마다 새 자가서명 키 (메모리에만) =====
  static SSLContext selfSignedContext(String host) throws GeneralSecurityException, OperatorCreationException {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
    KeyPairGenerator gen = KeyPairGenerator.getInstance("EC");
    gen.initialize(256);
    KeyPair keys = gen.generateKeyPair();

    char[] pass = new char[0];
    KeyStore store = KeyStore.getInstance("PKCS12");
    try {
      store.load(null, pass);
    } catch (IOException e) {
      throw new GeneralSecurityException("empty keystore init failed", e);
    }
    store.setKeyEntry(host, keys.getPrivate(), pass, new Certificate[]{ certificateFor(host, keys) });

    KeyManagerFactory kmf = KeyManagerFactory.getInstance("SunX509");
    kmf.init(store, pass);
    SSLContext ctx = SSLContext.getInstance("TLSv1.3");
    ctx.init(kmf.getKeyManagers(), null, null);
    return ctx;
  }

  static X509Certificate certificateFor(String host, KeyPair keys) throws GeneralSecurityException, OperatorCreationException {
    Instant now = Instant.now();
    X500Name name = new X500Name("CN=" + host + ",O=linkchex smoke");
    X509v3CertificateBuilder cb = new JcaX509v3CertificateBuilder(
        name, BigInteger.valueOf(now.toEpochMilli()),
        Date.from(now.minus(Duration.ofHours(1))), Date.from(now.plus(Duration.ofDays(30))),
        name, keys.getPublic());
    try {
      cb.addExtension(Extension.subjectAlternativeName, false,
          new GeneralNames(new GeneralName(GeneralName.dNSName, host)));
    } catch (CertIOException e) {
      throw new GeneralSecurityException("SAN extension failed", e);
    }
    ContentSigner signer = new JcaContentSignerBuilder("SHA256withECDSA")
        .setProvider(BouncyCastleProvider.PROVIDER_NAME).build(keys.getPrivate());
    return new JcaX509CertificateConverter()
        .setProvider(BouncyCastleProvider.PROVIDER_NAME).getCertificate(cb.build(signer));
  }

  // ===== 공통 유틸 =====
  static String urlset(String... locs) {
    StringBuilder sb = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
        .append("<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">\n");
    for (String loc : locs) {
      sb.append("  <url><loc>").append(loc).append("</loc><changefreq>weekly</changefreq></url>\n");
    }
    return sb.append("</urlset>\n").toString();
  }

  static String page(String title, String items) {
    return "<html><head><title>" + title + "</title></head><body>" +
        "<h1 id=\"top\">" + title + "</h1><ul>" + items + "</ul></body></html>";
  }

  static void redirect(HttpExchange ex, int code, String location) throws IOException {
    ex.getResponseHeaders().set("Location", location);
    ex.sendResponseHeaders(code, -1);
    ex.close();
  }

  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    respBytes(ex, code, ct + "; charset=utf-8", body.getBytes(StandardCharsets.UTF_8));
  }

  static void respBytes(HttpExchange ex, int code, String ct, byte[] b) throws IOException {
    ex.getResponseHeaders().set("Content-Type", ct);
    if ("HEAD".equalsIgnoreCase(ex.getRequestMethod())) {
      ex.sendResponseHeaders(code, -1);
      ex.close();
      return;
    }
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
