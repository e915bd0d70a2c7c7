package io.controlplane.certificate;

import io.controlplane.util.DirectoryUtils;
import io.controlplane.util.IpUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import static io.controlplane.config.Constants.KEY_FILE_MODE;

/**
 * Creates and loads the node's certificate authorities and leaf certificates.
 * Files that already exist are reused, never regenerated.
 */
@Slf4j
public class CertificateManager {

    private static final String SIGNATURE_ALGORITHM = "SHA256withRSA";
    private static final int KEY_SIZE = 2048;
    private static final Duration CA_VALIDITY = Duration.ofDays(3650);
    private static final Duration CERT_VALIDITY = Duration.ofDays(365);
    private static final String CERT_FILE_MODE = "rw-r--r--";

    @Getter
    private final Path certRootDir;
    private final SecureRandom random = new SecureRandom();

    public CertificateManager(Path certRootDir) {
        this.certRootDir = certRootDir;
    }

    public boolean hasCA(String name) {
        return Files.exists(certPath(name)) && Files.exists(keyPath(name));
    }

    /**
     * Ensure a self-signed CA named {@code name} exists, generating it if absent.
     */
    public Certificate ensureCA(String name, String commonName) throws IOException {
        if (hasCA(name)) {
            log.debug("CA {} already exists, reusing", name);
            return load(name);
        }
        try {
            KeyPair keyPair = generateKeyPair();
            X500Name subject = new X500NameBuilder(BCStyle.INSTANCE).addRDN(BCStyle.CN, commonName).build();
            Instant now = Instant.now();
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                subject, serial(), Date.from(now), Date.from(now.plus(CA_VALIDITY)), subject, keyPair.getPublic());
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(true));
            builder.addExtension(Extension.keyUsage, true,
                new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign | KeyUsage.digitalSignature));
            builder.addExtension(Extension.subjectKeyIdentifier, false,
                new JcaX509ExtensionUtils().createSubjectKeyIdentifier(keyPair.getPublic()));

            X509Certificate cert = sign(builder, keyPair.getPrivate());
            log.info("Generated CA {} ({})", name, commonName);
            return write(name, toPem(cert), toPem(keyPair.getPrivate()));
        } catch (GeneralSecurityException | OperatorCreationException e) {
            throw new IOException("failed to generate CA " + name, e);
        }
    }

    /**
     * Ensure the leaf certificate described by the request exists, signing it with its CA if absent.
     */
    public Certificate ensureCertificate(CertificateRequest request) throws IOException {
        if (Files.exists(certPath(request.getName())) && Files.exists(keyPath(request.getName()))) {
            log.debug("Certificate {} already exists, reusing", request.getName());
            return load(request.getName());
        }
        if (!hasCA(request.getCaName())) {
            throw new IOException("CA " + request.getCaName() + " not found in " + certRootDir);
        }
        try {
            Certificate ca = load(request.getCaName());
            X509CertificateHolder caHolder = parseCertificate(ca.certPem());
            PrivateKey caKey = parsePrivateKey(ca.keyPem());

            KeyPair keyPair = generateKeyPair();
            X500NameBuilder subject = new X500NameBuilder(BCStyle.INSTANCE);
            if (request.getOrganization() != null) {
                subject.addRDN(BCStyle.O, request.getOrganization());
            }
            subject.addRDN(BCStyle.CN, request.getCommonName());

            Instant now = Instant.now();
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                caHolder.getSubject(), serial(), Date.from(now), Date.from(now.plus(CERT_VALIDITY)),
                subject.build(), keyPair.getPublic());
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
            builder.addExtension(Extension.keyUsage, true,
                new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment));
            builder.addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(purposes(request)));
            if (!request.getHostnames().isEmpty()) {
                builder.addExtension(Extension.subjectAlternativeName, false, subjectAltNames(request.getHostnames()));
            }

            X509Certificate cert = sign(builder, caKey);
            log.info("Issued certificate {} (CN={}) signed by {}", request.getName(), request.getCommonName(),
                request.getCaName());
            return write(request.getName(), toPem(cert), toPem(keyPair.getPrivate()));
        } catch (GeneralSecurityException | OperatorCreationException e) {
            throw new IOException("failed to issue certificate " + request.getName(), e);
        }
    }

    /**
     * Ensure an RSA key pair named {@code name} exists as name.key and name.pub.
     */
    public void ensureKeyPair(String name) throws IOException {
        Path key = keyPath(name);
        Path pub = certRootDir.resolve(name + ".pub");
        if (Files.exists(key) && Files.exists(pub)) {
            return;
        }
        try {
            KeyPair keyPair = generateKeyPair();
            DirectoryUtils.writeFile(key, toPem(keyPair.getPrivate()).getBytes(StandardCharsets.UTF_8), KEY_FILE_MODE);
            DirectoryUtils.writeFile(pub, toPem(keyPair.getPublic()).getBytes(StandardCharsets.UTF_8), CERT_FILE_MODE);
            log.info("Generated key pair {}", name);
        } catch (GeneralSecurityException e) {
            throw new IOException("failed to generate key pair " + name, e);
        }
    }

    /**
     * Store PEM material received from elsewhere (e.g. a peer controller). Key files get restricted permissions.
     */
    public void writePem(String fileName, String pem) throws IOException {
        String mode = fileName.endsWith(".key") ? KEY_FILE_MODE : CERT_FILE_MODE;
        DirectoryUtils.writeFile(certRootDir.resolve(fileName), pem.getBytes(StandardCharsets.UTF_8), mode);
    }

    public String readPem(String fileName) throws IOException {
        return Files.readString(certRootDir.resolve(fileName));
    }

    public Certificate load(String name) throws IOException {
        return new Certificate(certPath(name), keyPath(name),
            Files.readString(certPath(name)), Files.readString(keyPath(name)));
    }

    public Path certPath(String name) {
        return certRootDir.resolve(name + ".crt");
    }

    public Path keyPath(String name) {
        return certRootDir.resolve(name + ".key");
    }

    private Certificate write(String name, String certPem, String keyPem) throws IOException {
        DirectoryUtils.writeFile(keyPath(name), keyPem.getBytes(StandardCharsets.UTF_8), KEY_FILE_MODE);
        DirectoryUtils.writeFile(certPath(name), certPem.getBytes(StandardCharsets.UTF_8), CERT_FILE_MODE);
        return new Certificate(certPath(name), keyPath(name), certPem, keyPem);
    }

    private KeyPair generateKeyPair() throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(KEY_SIZE, random);
        return generator.generateKeyPair();
    }

    private BigInteger serial() {
        return new BigInteger(64, random);
    }

    private X509Certificate sign(X509v3CertificateBuilder builder, PrivateKey signingKey)
            throws OperatorCreationException, GeneralSecurityException {
        ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(signingKey);
        return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
    }

    private static KeyPurposeId[] purposes(CertificateRequest request) {
        List<KeyPurposeId> purposes = new ArrayList<>();
        if (request.isServerAuth()) {
            purposes.add(KeyPurposeId.id_kp_serverAuth);
        }
        if (request.isClientAuth()) {
            purposes.add(KeyPurposeId.id_kp_clientAuth);
        }
        return purposes.toArray(new KeyPurposeId[0]);
    }

    private static GeneralNames subjectAltNames(List<String> hostnames) {
        GeneralName[] names = hostnames.stream()
            .distinct()
            .map(h -> IpUtils.isIpAddress(h)
                ? new GeneralName(GeneralName.iPAddress, h)
                : new GeneralName(GeneralName.dNSName, h))
            .toArray(GeneralName[]::new);
        return new GeneralNames(names);
    }

    private static X509CertificateHolder parseCertificate(String pem) throws IOException {
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object parsed = parser.readObject();
            if (parsed instanceof X509CertificateHolder holder) {
                return holder;
            }
            throw new IOException("PEM does not contain a certificate");
        }
    }

    static PrivateKey parsePrivateKey(String pem) throws IOException {
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object parsed = parser.readObject();
            JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
            if (parsed instanceof PEMKeyPair pair) {
                return converter.getKeyPair(pair).getPrivate();
            }
            if (parsed instanceof org.bouncycastle.asn1.pkcs.PrivateKeyInfo info) {
                return converter.getPrivateKey(info);
            }
            throw new IOException("PEM does not contain a private key");
        }
    }

    /**
     * Private keys are written as PKCS#8.
     */
    private static String toPem(Object object) throws IOException {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            if (object instanceof PrivateKey key) {
                writer.writeObject(new JcaPKCS8Generator(key, null));
            } else {
                writer.writeObject(object);
            }
        }
        return out.toString();
    }
}
