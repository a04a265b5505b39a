package io.gridmesh.security;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import javax.security.auth.x500.X500Principal;

public final class TrustRoots {
    private final List<X509Certificate> roots;

    private TrustRoots(List<X509Certificate> roots) {
        this.roots = List.copyOf(roots);
    }

    public static TrustRoots of(X509Certificate... roots) {
        return new TrustRoots(Arrays.asList(roots));
    }

    public static TrustRoots of(List<X509Certificate> roots) {
        return new TrustRoots(roots);
    }

    public static TrustRoots load(Path location) throws IOException {
        List<X509Certificate> out = new ArrayList<>();
        if (Files.isDirectory(location)) {
            List<Path> files = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(location)) {
                for (Path path : stream) {
                    String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
                    if (name.endsWith(".pem") || name.endsWith(".crt") || name.endsWith(".0")) {
                        files.add(path);
                    }
                }
            }
            files.sort(null);
            for (Path file : files) {
                out.addAll(read(file));
            }
        } else {
            out.addAll(read(location));
        }
        if (out.isEmpty()) {
            throw new IOException("no trust roots found at " + location);
        }
        return new TrustRoots(out);
    }

    private static List<X509Certificate> read(Path file) throws IOException {
        try {
            return CredentialParser.decode(Files.readAllBytes(file));
        } catch (CertificateException e) {
            throw new IOException("failed to read trust root " + file, e);
        }
    }

    public List<X509Certificate> issuedTo(X500Principal subject) {
        List<X509Certificate> matches = new ArrayList<>();
        for (X509Certificate root : roots) {
            if (root.getSubjectX500Principal().equals(subject)) {
                matches.add(root);
            }
        }
        return matches;
    }

    public boolean contains(X509Certificate certificate) {
        return roots.contains(certificate);
    }

    public X509Certificate[] asArray() {
        return roots.toArray(new X509Certificate[0]);
    }

    public int size() {
        return roots.size();
    }
}
