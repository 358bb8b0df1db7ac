package com.chessdiagrams;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

/**
 * Conversions between OpenCV matrices and AWT images.
 */
public final class MatConversions {

    private MatConversions() {
    }

    public static Mat toGray(Mat image) {
        if (image.channels() == 1) {
            return image;
        }
        Mat gray = new Mat();
        int code = image.channels() == 4 ? Imgproc.COLOR_BGRA2GRAY : Imgproc.COLOR_BGR2GRAY;
        Imgproc.cvtColor(image, gray, code);
        return gray;
    }

    public static BufferedImage toBufferedImage(Mat mat) throws IOException {
        MatOfByte mob = new MatOfByte();
        if (!Imgcodecs.imencode(".png", mat, mob)) {
            throw new IOException("Cannot encode " + mat.width() + "x" + mat.height() + " image");
        }
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(mob.toArray()));
        if (image == null) {
            throw new IOException("Cannot decode encoded image");
        }
        return image;
    }

    /** Decodes to a three-channel BGR matrix. */
    public static Mat fromBufferedImage(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        BufferedImage rgb = image;
        if (image.getType() != BufferedImage.TYPE_INT_RGB && image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
            rgb.createGraphics().drawImage(image, 0, 0, java.awt.Color.WHITE, null);
        }
        if (!ImageIO.write(rgb, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        Mat mat = Imgcodecs.imdecode(new MatOfByte(out.toByteArray()), Imgcodecs.IMREAD_COLOR);
        if (mat.empty()) {
            throw new IOException("Cannot decode " + image.getWidth() + "x" + image.getHeight() + " image");
        }
        return mat;
    }
}
