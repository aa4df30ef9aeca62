/**
 * S3 driver
 * <p>
 * Talks to AWS S3, MinIO and other S3-compatible stores through the AWS SDK v2 async client.
 */
package win.ixuni.splice.driver.s3;
